package com.rom.ei.operators;

import com.rom.ei.api.Parameter;

/**
 * Functional interface for vector-valued maps of a single vector.
 *
 * Implementations write the result into the pre-allocated {@code output}
 * array and must not keep references to either array.
 */
@FunctionalInterface
public interface VectorFunction {
    /**
     * @param input  the source vector (read only).
     * @param mu     the parameter, may be null.
     * @param output buffer of length {@code dimRange} to write into.
     */
    void compute(double[] input, Parameter mu, double[] output);
}
