package com.rom.ei.algorithms;

import com.rom.ei.api.VectorArray;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Mutable state of an EI-Greedy run: collateral basis, interpolation DOFs and
 * the interpolation matrix.
 *
 * Invariants (between extensions):
 * - {@code basis.len() == dofs.length}
 * - DOFs are pairwise distinct
 * - {@code matrix[i][j]} is component {@code dofs[i]} of basis vector j, with
 * a unit diagonal because every new vector is normalized at its own DOF.
 *
 * Owned by the single loop that drives it; not thread safe.
 */
public final class GreedyState {
    private final VectorArray basis;
    private final Set<Integer> selected = new HashSet<>();
    private int[] dofs = new int[0];
    private double[][] matrix = new double[0][0];

    /**
     * @param emptyBasis an empty array of the evaluations' type and dimension,
     *                   taken over by this state.
     */
    public GreedyState(VectorArray emptyBasis) {
        if (emptyBasis.len() != 0)
            throw new IllegalArgumentException("Initial basis must be empty, has " + emptyBasis.len() + " vectors");
        this.basis = emptyBasis;
    }

    public int size() {
        return dofs.length;
    }

    public boolean isSelected(int dof) {
        return selected.contains(dof);
    }

    /** Returns a copy of the selected DOFs in selection order. */
    public int[] dofs() {
        return dofs.clone();
    }

    /** Returns the basis itself; callers must treat it as read only. */
    public VectorArray basis() {
        return basis;
    }

    /** Returns a copy of the interpolation matrix. */
    public double[][] interpolationMatrix() {
        double[][] out = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++)
            out[i] = matrix[i].clone();
        return out;
    }

    /**
     * Appends a normalized basis vector together with its DOF.
     *
     * @param vector single-vector array, moved into the basis.
     * @param dof    component index at which {@code vector} equals 1.
     * @throws IllegalArgumentException if {@code dof} is already selected.
     */
    public void extend(VectorArray vector, int dof) {
        if (vector.len() != 1)
            throw new IllegalArgumentException("Expected a single vector, got " + vector.len());
        if (!selected.add(dof))
            throw new IllegalArgumentException("DOF " + dof + " already selected");
        dofs = Arrays.copyOf(dofs, dofs.length + 1);
        dofs[dofs.length - 1] = dof;
        basis.append(vector, true);

        // components() is (basis vector x dof); the matrix is its transpose
        double[][] c = basis.components(dofs);
        int k = dofs.length;
        matrix = new double[k][k];
        for (int i = 0; i < k; i++) {
            for (int j = 0; j < k; j++)
                matrix[i][j] = c[j][i];
        }
    }

    /**
     * Coefficients of the interpolants of the selected vectors of {@code u}.
     * Solves {@code M c = u[dofs]} by forward substitution, assuming M is unit
     * lower triangular; entries above the diagonal are ignored.
     *
     * @return matrix of shape {@code ind.length x size()}.
     */
    public double[][] interpolationCoefficients(VectorArray u, int[] ind) {
        double[][] rhs = u.components(dofs, ind);
        int k = dofs.length;
        for (double[] c : rhs) {
            for (int i = 0; i < k; i++) {
                double s = c[i];
                for (int j = 0; j < i; j++)
                    s -= matrix[i][j] * c[j];
                c[i] = s;
            }
        }
        return rhs;
    }

    /**
     * Empirical interpolants of the selected vectors of {@code u} as a new array.
     */
    public VectorArray interpolate(VectorArray u, int[] ind) {
        return basis.lincomb(interpolationCoefficients(u, ind));
    }

    /**
     * Largest absolute entry above the diagonal of the interpolation matrix.
     */
    public double triangularityError() {
        double err = 0.0;
        for (int i = 0; i < matrix.length; i++) {
            for (int j = i + 1; j < matrix.length; j++)
                err = Math.max(err, Math.abs(matrix[i][j]));
        }
        return err;
    }
}
