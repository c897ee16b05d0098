package com.rom.ei.operators;

import com.rom.ei.api.DimensionMismatchException;
import com.rom.ei.api.Operator;
import com.rom.ei.api.Parameter;
import com.rom.ei.api.VectorArray;
import com.rom.ei.la.DenseVectorArray;
import com.rom.ei.util.Indices;

/**
 * A (nonlinear) operator on dense vectors defined by a {@link VectorFunction},
 * applied vector by vector.
 */
public final class FunctionOperator implements Operator {
    private final int dimSource;
    private final int dimRange;
    private final VectorFunction fn;

    public FunctionOperator(int dimSource, int dimRange, VectorFunction fn) {
        this.dimSource = dimSource;
        this.dimRange = dimRange;
        this.fn = fn;
    }

    @Override
    public VectorArray apply(VectorArray u, Parameter mu) {
        if (u.dim() != dimSource)
            throw new DimensionMismatchException("Operator expects dimension " + dimSource + ", got " + u.dim());
        double[][] in = u.components(Indices.range(dimSource));
        DenseVectorArray out = DenseVectorArray.empty(dimRange, in.length);
        double[] buffer = new double[dimRange];
        for (double[] v : in) {
            fn.compute(v, mu, buffer);
            out.append(DenseVectorArray.of(buffer), true);
        }
        return out;
    }

    public int dimSource() {
        return dimSource;
    }

    @Override
    public int dimRange() {
        return dimRange;
    }

    @Override
    public VectorArray emptyRange(int reserve) {
        return DenseVectorArray.empty(dimRange, reserve);
    }
}
