package com.rom.ei.api;

/**
 * A symmetric positive definite bilinear form on vectors of one dimension.
 *
 * Used by the orthogonal projection of the greedy search and by POD in place
 * of the Euclidean inner product.
 */
@FunctionalInterface
public interface InnerProduct {

    /**
     * Non-pairwise application: entry (i, j) is the product of the i-th vector
     * of {@code u} with the j-th vector of {@code v}.
     *
     * @return matrix of shape {@code u.len() x v.len()}.
     */
    double[][] apply2(VectorArray u, VectorArray v);
}
