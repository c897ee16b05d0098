package com.rom.ei.algorithms;

import com.rom.ei.api.ErrorNorm;
import com.rom.ei.api.InnerProduct;
import com.rom.ei.api.NumericalException;
import com.rom.ei.api.VectorArray;
import com.rom.ei.util.ErrorNorms;
import com.rom.ei.util.Indices;

import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Computes the worst approximation error of a set of evaluations w.r.t. the
 * current collateral basis, and the vector proposed to extend the basis.
 *
 * Error measurement:
 * - empty basis: the residual is the evaluation itself.
 * - {@link Projection#EI}: residual = evaluation - empirical interpolant
 * (forward substitution on the unit lower triangular interpolation matrix).
 * - {@link Projection#ORTHOGONAL}: residual = evaluation - orthogonal
 * projection. The Gram matrix of the basis is Cholesky factorized once per
 * {@link #evaluate()} call.
 *
 * Candidate extraction:
 * With an empty basis or in EI mode the candidate is the residual of the worst
 * evaluation. In orthogonal mode with a non-empty basis the candidate is the
 * worst evaluation minus its empirical interpolant, not its orthogonal
 * residual. Error measurement and candidate extraction therefore use two
 * different reconstructions in that mode.
 *
 * {@link #evaluate()} reads the state and the evaluations only; calling it
 * twice without extending the state yields equal results.
 */
public final class ProjectionErrorEvaluator {
    // scipy-like behaviour: only a non-positive pivot is a failure
    static final double CHOLESKY_SYMMETRY_THRESHOLD = 1e-12;
    static final double CHOLESKY_POSITIVITY_THRESHOLD = 0.0;

    private final GreedyState state;
    private final List<? extends VectorArray> evaluations;
    private final Projection projection;
    private final ErrorNorm errorNorm;
    private final InnerProduct product;

    /**
     * @param errorNorm null for the Euclidean norm.
     * @param product   null for the Euclidean inner product; only used in
     *                  orthogonal mode.
     */
    public ProjectionErrorEvaluator(GreedyState state, List<? extends VectorArray> evaluations,
            Projection projection, ErrorNorm errorNorm, InnerProduct product) {
        this.state = state;
        this.evaluations = evaluations;
        this.projection = projection;
        this.errorNorm = ErrorNorms.orDefault(errorNorm);
        this.product = product;
    }

    /**
     * Sweeps all evaluation batches.
     *
     * @return the maximum error and a private copy of the proposed candidate;
     *         the candidate is null only if there are no evaluation vectors.
     * @throws NumericalException if the Gram matrix of the basis is not positive definite.
     */
    public ProjectionError evaluate() {
        final int k = state.size();
        final VectorArray basis = state.basis();
        final boolean orthogonal = projection == Projection.ORTHOGONAL && k > 0;

        DecompositionSolver gramSolver = orthogonal ? factorizeGramian(basis) : null;

        double maxErr = -1.0;
        VectorArray candidate = null;

        for (VectorArray au : evaluations) {
            if (au.len() == 0)
                continue;

            VectorArray residual;
            if (k == 0) {
                residual = au;
            } else if (!orthogonal) {
                residual = au.copy();
                residual.subtract(state.interpolate(au, Indices.range(au.len())));
            } else {
                double[][] rhs = product == null ? basis.dot(au) : product.apply2(basis, au);
                RealMatrix coefficients = gramSolver.solve(new Array2DRowRealMatrix(rhs, false)).transpose();
                residual = au.copy();
                residual.subtract(basis.lincomb(coefficients.getData()));
            }

            double[] errs = errorNorm.apply(residual);
            int worst = Indices.argmax(errs);
            if (worst < 0)
                continue;
            if (errs[worst] > maxErr) {
                maxErr = errs[worst];
                if (!orthogonal) {
                    candidate = residual.copy(worst);
                } else {
                    candidate = au.copy(worst);
                    candidate.subtract(state.interpolate(au, new int[] { worst }));
                }
            }
        }

        return new ProjectionError(maxErr, candidate);
    }

    private DecompositionSolver factorizeGramian(VectorArray basis) {
        double[][] gramian = product == null ? basis.gramian() : product.apply2(basis, basis);
        try {
            return new CholeskyDecomposition(new Array2DRowRealMatrix(gramian, false),
                    CHOLESKY_SYMMETRY_THRESHOLD, CHOLESKY_POSITIVITY_THRESHOLD).getSolver();
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            throw new NumericalException("Gram matrix of the collateral basis (size " + basis.len()
                    + ") is not symmetric positive definite", e);
        }
    }
}
