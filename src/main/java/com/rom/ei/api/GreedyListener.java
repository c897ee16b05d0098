package com.rom.ei.api;

/**
 * Observability hook for the greedy selection loops.
 *
 * Callbacks run synchronously inside the loop. Implementations must not
 * modify the vector arrays they are handed.
 */
public interface GreedyListener {

    /**
     * Called after the worst approximation error has been computed for the
     * current basis.
     *
     * @param basisSize current number of basis vectors / DOFs.
     * @param maxError  largest error over all evaluations.
     */
    default void onErrorEstimated(int basisSize, double maxError) {
    }

    /**
     * Called after a basis vector and its DOF were accepted.
     *
     * @param dofs                the DOFs selected so far (a copy).
     * @param basis               the current basis (read only).
     * @param triangularityError  deviation of the interpolation matrix from lower
     *                            triangular form, NaN where not tracked.
     */
    default void onExtended(int[] dofs, VectorArray basis, double triangularityError) {
    }

    /**
     * Called once when the loop terminates normally.
     */
    default void onStopped(StopReason reason, int basisSize) {
    }
}
