package com.rom.ei.algorithms;

import com.rom.ei.api.VectorArray;

/**
 * Interpolation data produced by {@link EiGreedy} or {@link Deim}.
 *
 * @param dofs    interpolation DOFs in selection order.
 * @param basis   collateral basis, one vector per DOF; owned by the caller.
 * @param history diagnostics of the run.
 */
public record GreedyResult(int[] dofs, VectorArray basis, GreedyHistory history) {

    public int size() {
        return dofs.length;
    }
}
