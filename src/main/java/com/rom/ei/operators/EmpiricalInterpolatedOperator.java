package com.rom.ei.operators;

import com.rom.ei.api.DimensionMismatchException;
import com.rom.ei.api.NumericalException;
import com.rom.ei.api.Operator;
import com.rom.ei.api.Parameter;
import com.rom.ei.api.VectorArray;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Replaces an operator by its empirical interpolant.
 *
 * {@code apply(u, mu)} evaluates the wrapped operator, keeps only the
 * components at the interpolation DOFs, solves the interpolation system for
 * the coefficients and returns the corresponding combination of the collateral
 * basis. The result matches the wrapped operator exactly at the DOFs.
 *
 * The wrapped operator is still evaluated in full; restricting the evaluation
 * itself to the DOFs is up to operators that support it.
 */
public final class EmpiricalInterpolatedOperator implements Operator {
    private final Operator operator;
    private final int[] dofs;
    private final VectorArray basis;
    private final DecompositionSolver solver;

    /**
     * @param operator operator to interpolate.
     * @param dofs     interpolation DOFs.
     * @param basis    collateral basis, copied.
     * @throws NumericalException if the interpolation matrix is singular.
     */
    public EmpiricalInterpolatedOperator(Operator operator, int[] dofs, VectorArray basis) {
        if (basis.len() != dofs.length)
            throw new DimensionMismatchException("Basis has " + basis.len() + " vectors but there are "
                    + dofs.length + " DOFs");
        if (basis.dim() != operator.dimRange())
            throw new DimensionMismatchException("Basis dimension " + basis.dim()
                    + " does not match operator range dimension " + operator.dimRange());
        this.operator = operator;
        this.dofs = dofs.clone();
        this.basis = basis.copy();
        this.solver = dofs.length == 0 ? null : factorize(this.basis, this.dofs);
    }

    private static DecompositionSolver factorize(VectorArray basis, int[] dofs) {
        // components() is (basis vector x dof); the interpolation matrix is its transpose
        RealMatrix m = new Array2DRowRealMatrix(basis.components(dofs), false).transpose();
        DecompositionSolver s = new LUDecomposition(m).getSolver();
        if (!s.isNonSingular())
            throw new NumericalException("Interpolation matrix of size " + dofs.length + " is singular");
        return s;
    }

    @Override
    public VectorArray apply(VectorArray u, Parameter mu) {
        VectorArray au = operator.apply(u, mu);
        if (solver == null)
            return basis.lincomb(new double[au.len()][0]);
        if (au.len() == 0)
            return operator.emptyRange(0);
        double[][] restricted = au.components(dofs);
        double[][] coefficients = solver.solve(new Array2DRowRealMatrix(restricted, false).transpose())
                .transpose().getData();
        return basis.lincomb(coefficients);
    }

    @Override
    public int dimRange() {
        return operator.dimRange();
    }

    @Override
    public VectorArray emptyRange(int reserve) {
        return operator.emptyRange(reserve);
    }

    public Operator operator() {
        return operator;
    }

    public int[] dofs() {
        return dofs.clone();
    }

    public VectorArray basis() {
        return basis.copy();
    }
}
