package com.rom.ei.api;

/**
 * Norm in which interpolation errors are measured.
 *
 * @see com.rom.ei.util.ErrorNorms
 */
@FunctionalInterface
public interface ErrorNorm {

    /**
     * @param residuals the error vectors.
     * @return one non-negative value per vector.
     */
    double[] apply(VectorArray residuals);
}
