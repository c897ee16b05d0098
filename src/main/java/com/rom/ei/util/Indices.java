package com.rom.ei.util;

/**
 * Small helpers for index arrays.
 */
public final class Indices {
    private Indices() {
        // Utility class
    }

    /** Returns {@code [0, 1, ..., n - 1]}. */
    public static int[] range(int n) {
        return range(0, n);
    }

    /** Returns {@code [from, from + 1, ..., to - 1]}, empty if {@code to <= from}. */
    public static int[] range(int from, int to) {
        int n = Math.max(0, to - from);
        int[] r = new int[n];
        for (int i = 0; i < n; i++)
            r[i] = from + i;
        return r;
    }

    /** Index of the first maximum, -1 for an empty array. NaN entries are skipped. */
    public static int argmax(double[] values) {
        int best = -1;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i]))
                continue;
            if (best < 0 || values[i] > values[best])
                best = i;
        }
        return best;
    }
}
