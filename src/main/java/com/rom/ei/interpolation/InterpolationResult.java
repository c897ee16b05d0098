package com.rom.ei.interpolation;

import com.rom.ei.algorithms.GreedyHistory;
import com.rom.ei.api.Discretization;
import com.rom.ei.api.VectorArray;

/**
 * Output of {@link OperatorInterpolation}: the discretization with interpolated
 * operators plus the interpolation data it was built from.
 *
 * @param discretization copy of the input discretization whose selected operators
 *                       are replaced by empirical interpolants.
 * @param dofs           interpolation DOFs.
 * @param basis          collateral basis.
 * @param history        diagnostics of the greedy run.
 */
public record InterpolationResult(Discretization discretization, int[] dofs, VectorArray basis,
        GreedyHistory history) {
}
