package com.rom.ei.la;

import com.rom.ei.api.DimensionMismatchException;
import com.rom.ei.api.InnerProduct;
import com.rom.ei.api.InvalidConfigurationException;
import com.rom.ei.api.NumericalException;
import com.rom.ei.api.VectorArray;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Proper orthogonal decomposition by the method of snapshots.
 *
 * Algorithm:
 * 1. Form the Gram matrix {@code B} of the snapshots (Euclidean or w.r.t. the
 * given inner product) and symmetrize it.
 * 2. Eigendecompose {@code B}; eigenvalues are the squared singular values of
 * the snapshot matrix.
 * 3. Keep the modes whose eigenvalue is at least {@code tol} times the largest
 * one, at most {@code modes} of them.
 * 4. Mode r is {@code sum_j evec_r[j] / sqrt(eval_r) * snapshot_j}.
 * 5. Re-orthonormalize with {@link GramSchmidt} and verify orthonormality.
 *
 * The Gram matrix is only {@code len x len}, so this is the method of choice
 * when there are far fewer snapshots than dimensions.
 */
@Log4j2
public final class Pod {
    public static final double DEFAULT_TOL = 4e-8;
    public static final double DEFAULT_CHECK_TOL = 1e-10;

    private Pod() {
        // Utility class
    }

    /**
     * @param snapshots the data to compress, not modified.
     * @param modes     maximum number of modes, null for all modes above tolerance.
     * @param product   inner product, null for the Euclidean one.
     * @return orthonormal modes ordered by decreasing singular value.
     */
    public static VectorArray pod(VectorArray snapshots, Integer modes, InnerProduct product) {
        return pod(snapshots, modes, product, DEFAULT_TOL, true, DEFAULT_CHECK_TOL);
    }

    public static VectorArray pod(VectorArray snapshots, Integer modes, InnerProduct product, double tol,
            boolean orthonormalize, double checkTol) {
        if (modes != null && modes < 1)
            throw new InvalidConfigurationException("Number of POD modes must be positive, got " + modes);
        if (snapshots.len() == 0)
            throw new DimensionMismatchException("Cannot compute POD of an empty set of snapshots");

        int n = snapshots.len();
        double[][] b = product == null ? snapshots.gramian() : product.apply2(snapshots, snapshots);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double s = 0.5 * (b[i][j] + b[j][i]);
                b[i][j] = s;
                b[j][i] = s;
            }
        }

        EigenDecomposition eig = new EigenDecomposition(new Array2DRowRealMatrix(b, false));
        double[] evals = eig.getRealEigenvalues();
        Integer[] order = IntStream.range(0, evals.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> evals[i]).reversed());

        double largest = evals[order[0]];
        if (!(largest > 0.0)) {
            log.info("All snapshots vanish, POD is empty");
            return snapshots.emptyLike(0);
        }

        int keep = 0;
        while (keep < order.length && evals[order[keep]] >= tol * largest)
            keep++;
        if (modes != null)
            keep = Math.min(keep, modes);

        double[][] coefficients = new double[keep][];
        for (int r = 0; r < keep; r++) {
            RealVector evec = eig.getEigenvector(order[r]);
            coefficients[r] = evec.mapDivide(Math.sqrt(evals[order[r]])).toArray();
        }
        VectorArray pod = snapshots.lincomb(coefficients);
        log.info("POD: keeping {} of {} modes, singular values {} .. {}", keep, n,
                Math.sqrt(largest), Math.sqrt(Math.max(evals[order[keep - 1]], 0.0)));

        if (orthonormalize)
            pod = GramSchmidt.orthonormalize(pod, product);

        if (checkTol > 0.0) {
            double err = GramSchmidt.orthonormalityError(pod, product);
            if (err > checkTol)
                throw new NumericalException("POD modes are not orthonormal, deviation " + err);
        }
        return pod;
    }

    /**
     * Returns the singular values of the snapshot set in decreasing order.
     */
    public static double[] singularValues(VectorArray snapshots, InnerProduct product) {
        double[][] b = product == null ? snapshots.gramian() : product.apply2(snapshots, snapshots);
        if (b.length == 0)
            return new double[0];
        RealMatrix m = new Array2DRowRealMatrix(b, false);
        m = m.add(m.transpose()).scalarMultiply(0.5);
        double[] evals = new EigenDecomposition(m).getRealEigenvalues();
        return Arrays.stream(evals)
                .map(e -> Math.sqrt(Math.max(e, 0.0)))
                .boxed()
                .sorted(Comparator.reverseOrder())
                .mapToDouble(Double::doubleValue)
                .toArray();
    }
}
