package com.rom.ei.api;

/**
 * A (possibly nonlinear, parameter dependent) mapping between vector arrays.
 */
public interface Operator {

    /**
     * Applies the operator to every vector of {@code u}.
     *
     * @param u  source vectors.
     * @param mu parameter at which to evaluate, may be null for
     *           parameter-independent operators.
     * @return one range vector per source vector.
     */
    VectorArray apply(VectorArray u, Parameter mu);

    /**
     * Dimension of the range vectors.
     */
    int dimRange();

    /**
     * Creates an empty array of the range type.
     *
     * @param reserve capacity hint.
     */
    VectorArray emptyRange(int reserve);
}
