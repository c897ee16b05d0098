package com.rom.ei.api;

/**
 * An ordered, mutable collection of vectors that all share the same dimension.
 *
 * This is the capability set the interpolation algorithms need from a vector
 * container. Concrete variants (dense in-memory arrays, distributed arrays,
 * arrays backed by an external solver) implement it; the algorithms never look
 * at the storage behind it.
 *
 * Ownership:
 * A VectorArray is exclusively owned by whichever component currently holds it.
 * Methods returning a VectorArray always return a fresh array that does not
 * alias the storage of this one.
 *
 * Index conventions:
 * - "vector index" (often called {@code ind}) selects vectors inside the array,
 * 0 to len() - 1.
 * - "component index" (DOF) selects an entry inside each vector, 0 to dim() - 1.
 */
public interface VectorArray {

    /**
     * Returns the dimension shared by all vectors of this array.
     */
    int dim();

    /**
     * Returns the number of vectors in this array.
     */
    int len();

    /**
     * Extracts the given components of every vector.
     *
     * @param componentIndices component indices to extract.
     * @return matrix of shape {@code len() x componentIndices.length}.
     */
    double[][] components(int[] componentIndices);

    /**
     * Extracts the given components of the selected vectors.
     *
     * @param componentIndices component indices to extract.
     * @param ind              vector indices to extract them from.
     * @return matrix of shape {@code ind.length x componentIndices.length}.
     */
    double[][] components(int[] componentIndices, int[] ind);

    /**
     * Euclidean inner products between all vectors of this array and all
     * vectors of {@code other}.
     *
     * @return matrix of shape {@code len() x other.len()}.
     */
    double[][] dot(VectorArray other);

    /**
     * Euclidean inner products between the i-th vector of this array and the
     * i-th vector of {@code other}. Both arrays must have the same length.
     */
    double[] pairwiseDot(VectorArray other);

    /**
     * Returns the Gram matrix of this array w.r.t. the Euclidean inner product.
     * The result is exactly symmetric.
     */
    double[][] gramian();

    /**
     * Returns the Euclidean norm of each vector.
     */
    double[] l2Norm();

    /**
     * Locates the component of largest magnitude in each vector.
     */
    AbsMax amax();

    /**
     * Forms linear combinations of the vectors of this array.
     *
     * @param coefficients matrix of shape {@code m x len()}; row r holds the
     *                     coefficients of the r-th combination.
     * @return a new array holding the {@code m} combinations.
     */
    VectorArray lincomb(double[][] coefficients);

    /**
     * Forms linear combinations of the selected vectors of this array.
     *
     * @param coefficients matrix of shape {@code m x ind.length}.
     * @param ind          vector indices that enter the combinations.
     */
    VectorArray lincomb(double[][] coefficients, int[] ind);

    /**
     * Appends the vectors of {@code other} to this array.
     *
     * @param removeFromOther if true, the vectors are moved, leaving
     *                        {@code other} empty.
     */
    void append(VectorArray other, boolean removeFromOther);

    /**
     * Returns a deep copy of this array.
     */
    VectorArray copy();

    /**
     * Returns a deep copy of the selected vectors.
     */
    VectorArray copy(int... ind);

    /**
     * Removes the selected vectors, keeping the order of the remaining ones.
     */
    void remove(int... ind);

    /**
     * Scales every vector in place.
     */
    void scal(double alpha);

    /**
     * In-place {@code this += alpha * x}. If {@code x} holds a single vector it
     * is added to every vector of this array, otherwise lengths must match.
     */
    void axpy(double alpha, VectorArray x);

    /**
     * In-place {@code this -= other}.
     */
    default void subtract(VectorArray other) {
        axpy(-1.0, other);
    }

    /**
     * Creates an empty array of the same type and dimension.
     *
     * @param reserve capacity hint.
     */
    VectorArray emptyLike(int reserve);

    /**
     * Returns true if {@code other} has the same type and dimension, i.e. the
     * two arrays can be combined.
     */
    boolean isCompatible(VectorArray other);
}
