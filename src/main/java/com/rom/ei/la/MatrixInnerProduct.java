package com.rom.ei.la;

import com.rom.ei.api.DimensionMismatchException;
import com.rom.ei.api.InnerProduct;
import com.rom.ei.api.VectorArray;
import com.rom.ei.util.Indices;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Inner product {@code (u, v) = u^T A v} given by a symmetric positive definite
 * matrix {@code A}.
 *
 * Symmetry is checked on construction; definiteness is not, a defective matrix
 * shows up later as a failed Cholesky factorization.
 */
public final class MatrixInnerProduct implements InnerProduct {
    private final RealMatrix matrix;

    public MatrixInnerProduct(double[][] matrix) {
        this(new Array2DRowRealMatrix(matrix, true));
    }

    public MatrixInnerProduct(RealMatrix matrix) {
        if (!matrix.isSquare())
            throw new DimensionMismatchException("Inner product matrix must be square, got "
                    + matrix.getRowDimension() + "x" + matrix.getColumnDimension());
        if (!MatrixUtils.isSymmetric(matrix, 1e-12))
            throw new IllegalArgumentException("Inner product matrix must be symmetric");
        this.matrix = matrix.copy();
    }

    /**
     * Weighted Euclidean product with the given positive weights on the diagonal.
     */
    public static MatrixInnerProduct diagonal(double... weights) {
        for (double w : weights) {
            if (!(w > 0.0))
                throw new IllegalArgumentException("Weights must be positive, got " + w);
        }
        return new MatrixInnerProduct(MatrixUtils.createRealDiagonalMatrix(weights));
    }

    public int dim() {
        return matrix.getRowDimension();
    }

    @Override
    public double[][] apply2(VectorArray u, VectorArray v) {
        int n = dim();
        if (u.dim() != n || v.dim() != n)
            throw new DimensionMismatchException("Inner product of dimension " + n + " applied to vectors of dimension "
                    + u.dim() + " and " + v.dim());
        if (u.len() == 0 || v.len() == 0)
            return new double[u.len()][v.len()];
        int[] all = Indices.range(n);
        // rows of U and V are the vectors: result = U A V^T
        RealMatrix um = new Array2DRowRealMatrix(u.components(all), false);
        RealMatrix vm = new Array2DRowRealMatrix(v.components(all), false);
        return um.multiply(matrix).multiply(vm.transpose()).getData();
    }
}
