package com.rom.ei.la;

import com.rom.ei.api.AbsMax;
import com.rom.ei.api.DimensionMismatchException;
import com.rom.ei.api.VectorArray;
import com.rom.ei.util.Indices;

import java.util.Arrays;

/**
 * In-memory {@link VectorArray} holding one {@code double[]} per vector.
 *
 * Storage layout:
 * Vectors are kept as rows of a {@code double[][]} that grows geometrically on
 * append, like an ArrayList. Rows are never shared with another array: every
 * operation that hands out vectors copies them, and
 * {@link #append(VectorArray, boolean)} with {@code removeFromOther} only
 * transfers row ownership between two dense arrays.
 */
public final class DenseVectorArray implements VectorArray {
    private final int dim;
    private double[][] rows;
    private int len;

    public DenseVectorArray(int dim) {
        this(dim, 4);
    }

    private DenseVectorArray(int dim, int reserve) {
        if (dim < 0)
            throw new IllegalArgumentException("Negative dimension: " + dim);
        this.dim = dim;
        this.rows = new double[Math.max(reserve, 1)][];
    }

    /**
     * Creates an empty array of dimension {@code dim}.
     */
    public static DenseVectorArray empty(int dim) {
        return new DenseVectorArray(dim);
    }

    /**
     * Creates an empty array of dimension {@code dim} with room for
     * {@code reserve} vectors.
     */
    public static DenseVectorArray empty(int dim, int reserve) {
        return new DenseVectorArray(dim, reserve);
    }

    /**
     * Creates an array from the given vectors, copying them.
     *
     * @throws IllegalArgumentException if the vectors differ in length or none is given.
     */
    public static DenseVectorArray of(double[]... vectors) {
        if (vectors.length == 0)
            throw new IllegalArgumentException("At least one vector is required to infer the dimension");
        DenseVectorArray a = new DenseVectorArray(vectors[0].length, vectors.length);
        for (double[] v : vectors)
            a.appendRow(v.clone());
        return a;
    }

    /**
     * Creates {@code count} zero vectors of dimension {@code dim}.
     */
    public static DenseVectorArray zeros(int dim, int count) {
        DenseVectorArray a = new DenseVectorArray(dim, count);
        for (int i = 0; i < count; i++)
            a.appendRow(new double[dim]);
        return a;
    }

    @Override
    public int dim() {
        return dim;
    }

    @Override
    public int len() {
        return len;
    }

    /**
     * Returns a copy of the i-th vector.
     */
    public double[] toArray(int i) {
        checkIndex(i);
        return rows[i].clone();
    }

    /**
     * Returns a copy of all vectors as rows of a matrix.
     */
    public double[][] toMatrix() {
        double[][] out = new double[len][];
        for (int i = 0; i < len; i++)
            out[i] = rows[i].clone();
        return out;
    }

    /**
     * Reads a single component without copying.
     */
    public double get(int vector, int component) {
        checkIndex(vector);
        return rows[vector][component];
    }

    @Override
    public double[][] components(int[] componentIndices) {
        return components(componentIndices, Indices.range(len));
    }

    @Override
    public double[][] components(int[] componentIndices, int[] ind) {
        for (int c : componentIndices) {
            if (c < 0 || c >= dim)
                throw new IndexOutOfBoundsException("Component " + c + " out of range for dimension " + dim);
        }
        double[][] out = new double[ind.length][componentIndices.length];
        for (int r = 0; r < ind.length; r++) {
            checkIndex(ind[r]);
            double[] row = rows[ind[r]];
            for (int c = 0; c < componentIndices.length; c++)
                out[r][c] = row[componentIndices[c]];
        }
        return out;
    }

    @Override
    public double[][] dot(VectorArray other) {
        DenseVectorArray o = requireDense(other);
        double[][] out = new double[len][o.len];
        for (int i = 0; i < len; i++) {
            for (int j = 0; j < o.len; j++)
                out[i][j] = dot(rows[i], o.rows[j]);
        }
        return out;
    }

    @Override
    public double[] pairwiseDot(VectorArray other) {
        DenseVectorArray o = requireDense(other);
        if (o.len != len)
            throw new DimensionMismatchException("Pairwise dot needs equal lengths, got " + len + " and " + o.len);
        double[] out = new double[len];
        for (int i = 0; i < len; i++)
            out[i] = dot(rows[i], o.rows[i]);
        return out;
    }

    @Override
    public double[][] gramian() {
        double[][] g = new double[len][len];
        for (int i = 0; i < len; i++) {
            for (int j = i; j < len; j++) {
                double d = dot(rows[i], rows[j]);
                g[i][j] = d;
                g[j][i] = d;
            }
        }
        return g;
    }

    @Override
    public double[] l2Norm() {
        double[] out = new double[len];
        for (int i = 0; i < len; i++)
            out[i] = Math.sqrt(dot(rows[i], rows[i]));
        return out;
    }

    @Override
    public AbsMax amax() {
        int[] indices = new int[len];
        double[] values = new double[len];
        for (int i = 0; i < len; i++) {
            double[] row = rows[i];
            int best = 0;
            double bestAbs = -1.0;
            for (int c = 0; c < dim; c++) {
                double a = Math.abs(row[c]);
                if (a > bestAbs) {
                    bestAbs = a;
                    best = c;
                }
            }
            indices[i] = best;
            values[i] = dim > 0 ? row[best] : Double.NaN;
        }
        return new AbsMax(indices, values);
    }

    @Override
    public VectorArray lincomb(double[][] coefficients) {
        return lincomb(coefficients, Indices.range(len));
    }

    @Override
    public VectorArray lincomb(double[][] coefficients, int[] ind) {
        DenseVectorArray out = new DenseVectorArray(dim, coefficients.length);
        for (double[] coeffs : coefficients) {
            if (coeffs.length != ind.length)
                throw new DimensionMismatchException(
                        "Expected " + ind.length + " coefficients per combination, got " + coeffs.length);
            double[] acc = new double[dim];
            for (int k = 0; k < ind.length; k++) {
                checkIndex(ind[k]);
                double a = coeffs[k];
                if (a == 0.0)
                    continue;
                double[] row = rows[ind[k]];
                for (int c = 0; c < dim; c++)
                    acc[c] += a * row[c];
            }
            out.appendRow(acc);
        }
        return out;
    }

    @Override
    public void append(VectorArray other, boolean removeFromOther) {
        DenseVectorArray o = requireDense(other);
        if (o == this) {
            if (removeFromOther)
                throw new IllegalArgumentException("Cannot move vectors of an array into itself");
            o = (DenseVectorArray) copy();
        }
        for (int i = 0; i < o.len; i++)
            appendRow(removeFromOther ? o.rows[i] : o.rows[i].clone());
        if (removeFromOther) {
            Arrays.fill(o.rows, 0, o.len, null);
            o.len = 0;
        }
    }

    @Override
    public VectorArray copy() {
        return copy(Indices.range(len));
    }

    @Override
    public VectorArray copy(int... ind) {
        DenseVectorArray out = new DenseVectorArray(dim, ind.length);
        for (int i : ind) {
            checkIndex(i);
            out.appendRow(rows[i].clone());
        }
        return out;
    }

    @Override
    public void remove(int... ind) {
        boolean[] drop = new boolean[len];
        for (int i : ind) {
            checkIndex(i);
            drop[i] = true;
        }
        int w = 0;
        for (int r = 0; r < len; r++) {
            if (!drop[r])
                rows[w++] = rows[r];
        }
        Arrays.fill(rows, w, len, null);
        len = w;
    }

    @Override
    public void scal(double alpha) {
        for (int i = 0; i < len; i++) {
            double[] row = rows[i];
            for (int c = 0; c < dim; c++)
                row[c] *= alpha;
        }
    }

    @Override
    public void axpy(double alpha, VectorArray x) {
        DenseVectorArray o = requireDense(x);
        if (o.len != len && o.len != 1)
            throw new DimensionMismatchException("axpy needs equal lengths or a single vector, got "
                    + len + " and " + o.len);
        for (int i = 0; i < len; i++) {
            double[] row = rows[i];
            double[] xr = o.rows[o.len == 1 ? 0 : i];
            for (int c = 0; c < dim; c++)
                row[c] += alpha * xr[c];
        }
    }

    @Override
    public VectorArray emptyLike(int reserve) {
        return new DenseVectorArray(dim, reserve);
    }

    @Override
    public boolean isCompatible(VectorArray other) {
        return other instanceof DenseVectorArray && other.dim() == dim;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DenseVectorArray(dim=").append(dim).append(", len=").append(len);
        if (len <= 8) {
            sb.append(", [");
            for (int i = 0; i < len; i++) {
                if (i > 0)
                    sb.append(", ");
                sb.append(Arrays.toString(rows[i]));
            }
            sb.append(']');
        }
        return sb.append(')').toString();
    }

    private void appendRow(double[] row) {
        if (row.length != dim)
            throw new DimensionMismatchException("Vector of length " + row.length + " in array of dimension " + dim);
        if (len == rows.length)
            rows = Arrays.copyOf(rows, Math.max(4, len * 2));
        rows[len++] = row;
    }

    private DenseVectorArray requireDense(VectorArray other) {
        if (!isCompatible(other))
            throw new DimensionMismatchException("Incompatible vector arrays: " + describe(this) + " and "
                    + describe(other));
        return (DenseVectorArray) other;
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= len)
            throw new IndexOutOfBoundsException("Vector index " + i + " out of range for length " + len);
    }

    private static String describe(VectorArray a) {
        return a.getClass().getSimpleName() + "(dim=" + a.dim() + ")";
    }

    private static double dot(double[] a, double[] b) {
        double s = 0.0;
        for (int c = 0; c < a.length; c++)
            s += a[c] * b[c];
        return s;
    }
}
