package com.rom.ei.algorithms;

import com.rom.ei.api.DimensionMismatchException;
import com.rom.ei.api.ErrorNorm;
import com.rom.ei.api.GreedyListener;
import com.rom.ei.api.NumericalException;
import com.rom.ei.api.StopReason;
import com.rom.ei.api.VectorArray;
import com.rom.ei.la.Pod;
import com.rom.ei.util.ErrorNorms;
import com.rom.ei.util.Indices;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * Empirical interpolation data by the Discrete Empirical Interpolation Method.
 *
 * The collateral basis is fixed up front: the leading POD modes of the
 * evaluations. The greedy part only assigns DOFs, mode by mode: the DOF of mode
 * i is the largest-magnitude component of the residual of mode i after
 * interpolating it with modes 0..i-1 at their DOFs.
 *
 * The interpolation matrix of POD modes is not unit lower triangular, so the
 * interpolation coefficients come from a general LU solve.
 *
 * If a DOF would be selected twice, the remaining modes are discarded and the
 * basis is truncated to the accepted ones; {@link GreedyHistory#truncated()}
 * tells callers the result is smaller than requested.
 */
@Log4j2
public final class Deim {
    private Deim() {
        // Utility class
    }

    /**
     * @param evaluations operator evaluations, not modified.
     * @throws DimensionMismatchException if {@code evaluations} is empty.
     * @throws NumericalException         if an interpolation matrix is singular or POD fails.
     */
    public static GreedyResult run(VectorArray evaluations, DeimConfig config) {
        if (evaluations == null || evaluations.len() == 0)
            throw new DimensionMismatchException("No operator evaluations given");
        if (evaluations.dim() == 0)
            throw new DimensionMismatchException("Evaluations have dimension 0");

        log.info("Generating interpolation data (DEIM, modes={}) ...", config.modes());

        VectorArray basis = Pod.pod(evaluations, config.modes(), config.product());
        return selectDofs(basis, config.modes(), ErrorNorms.orDefault(config.errorNorm()), config.listener());
    }

    /**
     * DOF selection on a given basis; the basis is truncated in place to the
     * accepted vectors.
     *
     * @param requestedModes number of modes asked for, null if unlimited.
     */
    static GreedyResult selectDofs(VectorArray basis, Integer requestedModes, ErrorNorm norm,
            GreedyListener listener) {
        final int podModes = basis.len();
        int[] dofs = new int[0];
        Set<Integer> selected = new HashSet<>();
        double[][] matrix = new double[0][0];
        List<Double> errs = new ArrayList<>();
        StopReason reason = StopReason.BASIS_EXHAUSTED;

        for (int i = 0; i < podModes; i++) {
            int k = dofs.length;
            VectorArray residual = basis.copy(i);
            if (k > 0) {
                double[] rhs = basis.components(dofs, new int[] { i })[0];
                double[] coefficients = solve(matrix, rhs);
                residual.subtract(basis.lincomb(new double[][] { coefficients }, Indices.range(k)));
            }

            double err = norm.apply(residual)[0];
            log.info("Interpolation error for basis vector {}: {}", i, err);
            listener.onErrorEstimated(k, err);

            int newDof = residual.amax().index(0);
            if (selected.contains(newDof)) {
                log.info("DOF {} selected twice for interpolation! Stopping extension loop.", newDof);
                reason = StopReason.DOF_COLLISION;
                break;
            }

            selected.add(newDof);
            dofs = Arrays.copyOf(dofs, k + 1);
            dofs[k] = newDof;
            matrix = transpose(basis.components(dofs, Indices.range(k + 1)));
            errs.add(err);
            listener.onExtended(dofs.clone(), basis.copy(Indices.range(k + 1)), Double.NaN);
        }

        if (dofs.length < podModes)
            basis.remove(Indices.range(dofs.length, podModes));

        GreedyHistory history = GreedyHistory.ofDeim(errs, reason, requestedModes, podModes);
        log.info("Finished: {} DOFs, stop reason {}{}", dofs.length, reason,
                history.truncated() ? " (fewer basis vectors than requested)" : "");
        listener.onStopped(reason, dofs.length);
        return new GreedyResult(dofs, basis, history);
    }

    private static double[] solve(double[][] matrix, double[] rhs) {
        try {
            return new LUDecomposition(new Array2DRowRealMatrix(matrix, false)).getSolver()
                    .solve(new ArrayRealVector(rhs, false)).toArray();
        } catch (SingularMatrixException e) {
            throw new NumericalException("DEIM interpolation matrix of size " + matrix.length + " is singular", e);
        }
    }

    private static double[][] transpose(double[][] m) {
        int rows = m.length;
        int cols = rows == 0 ? 0 : m[0].length;
        double[][] t = new double[cols][rows];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++)
                t[j][i] = m[i][j];
        }
        return t;
    }
}
