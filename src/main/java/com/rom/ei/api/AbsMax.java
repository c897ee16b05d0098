package com.rom.ei.api;

/**
 * Position and value of the largest-magnitude component, one entry per vector.
 *
 * Ties are resolved towards the smallest component index. The values are the
 * signed components, not their magnitudes.
 */
public record AbsMax(int[] indices, double[] values) {

    public int index(int vector) {
        return indices[vector];
    }

    public double value(int vector) {
        return values[vector];
    }
}
