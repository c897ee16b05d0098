package com.rom.ei.api;

/**
 * Why a greedy selection loop terminated. Every value is a normal, successful
 * outcome.
 */
public enum StopReason {
    /** The largest approximation error fell to or below the target error. */
    CONVERGED,
    /** The configured maximum number of interpolation DOFs was reached. */
    MAX_DOFS_REACHED,
    /** The next DOF had already been selected; the basis could not be extended. */
    DOF_COLLISION,
    /**
     * EI-Greedy only: the proposed basis vector is zero, every evaluation is
     * already reproduced by its interpolant. Reported whether or not a target
     * error is set.
     */
    CANDIDATE_VANISHED,
    /** DEIM only: every POD mode received its own DOF. */
    BASIS_EXHAUSTED
}
