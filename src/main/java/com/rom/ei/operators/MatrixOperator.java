package com.rom.ei.operators;

import com.rom.ei.api.DimensionMismatchException;
import com.rom.ei.api.Operator;
import com.rom.ei.api.Parameter;
import com.rom.ei.api.VectorArray;
import com.rom.ei.la.DenseVectorArray;
import com.rom.ei.util.Indices;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Parameter-independent linear operator given by a dense matrix.
 */
public final class MatrixOperator implements Operator {
    private final RealMatrix matrix;

    public MatrixOperator(double[][] matrix) {
        this(new Array2DRowRealMatrix(matrix, true));
    }

    public MatrixOperator(RealMatrix matrix) {
        this.matrix = matrix.copy();
    }

    @Override
    public VectorArray apply(VectorArray u, Parameter mu) {
        int dimSource = matrix.getColumnDimension();
        if (u.dim() != dimSource)
            throw new DimensionMismatchException("Operator expects dimension " + dimSource + ", got " + u.dim());
        DenseVectorArray out = DenseVectorArray.empty(dimRange(), u.len());
        if (u.len() == 0)
            return out;
        double[][] in = u.components(Indices.range(dimSource));
        for (double[] v : in)
            out.append(DenseVectorArray.of(matrix.operate(v)), true);
        return out;
    }

    @Override
    public int dimRange() {
        return matrix.getRowDimension();
    }

    @Override
    public VectorArray emptyRange(int reserve) {
        return DenseVectorArray.empty(dimRange(), reserve);
    }
}
