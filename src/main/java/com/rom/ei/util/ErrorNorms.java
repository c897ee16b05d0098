package com.rom.ei.util;

import com.rom.ei.api.ErrorNorm;
import com.rom.ei.api.InnerProduct;
import com.rom.ei.api.VectorArray;

/**
 * Standard implementations of ErrorNorm.
 */
public final class ErrorNorms {
    private ErrorNorms() {
        // Utility class
    }

    /** Euclidean norm, the default of the greedy algorithms. */
    public static final ErrorNorm EUCLIDEAN = VectorArray::l2Norm;

    /** Maximum norm: largest absolute component of each vector. */
    public static final ErrorNorm SUP = residuals -> {
        double[] values = residuals.amax().values();
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++)
            out[i] = Math.abs(values[i]);
        return out;
    };

    /**
     * Norm induced by an inner product: {@code sqrt((v, v))}.
     * Negative round-off in {@code (v, v)} is clamped to zero.
     */
    public static ErrorNorm induced(InnerProduct product) {
        return residuals -> {
            double[][] g = product.apply2(residuals, residuals);
            double[] out = new double[g.length];
            for (int i = 0; i < g.length; i++)
                out[i] = Math.sqrt(Math.max(g[i][i], 0.0));
            return out;
        };
    }

    /** Returns {@code norm}, or {@link #EUCLIDEAN} if it is null. */
    public static ErrorNorm orDefault(ErrorNorm norm) {
        return norm != null ? norm : EUCLIDEAN;
    }
}
