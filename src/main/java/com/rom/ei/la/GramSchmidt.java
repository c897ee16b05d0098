package com.rom.ei.la;

import com.rom.ei.api.InnerProduct;
import com.rom.ei.api.VectorArray;

import lombok.extern.log4j.Log4j2;

/**
 * Modified Gram-Schmidt orthonormalization with one re-orthogonalization pass.
 */
@Log4j2
public final class GramSchmidt {
    /** Vectors whose norm drops below this fraction of their initial norm are removed. */
    public static final double DEFAULT_RTOL = 1e-14;
    public static final double DEFAULT_ATOL = 1e-13;

    private GramSchmidt() {
        // Utility class
    }

    public static VectorArray orthonormalize(VectorArray a, InnerProduct product) {
        return orthonormalize(a, product, DEFAULT_ATOL, DEFAULT_RTOL);
    }

    /**
     * Orthonormalizes the vectors of {@code a} in order and returns the result
     * as a new array. Linearly dependent vectors are dropped.
     *
     * @param product inner product to use, null for the Euclidean one.
     */
    public static VectorArray orthonormalize(VectorArray a, InnerProduct product, double atol, double rtol) {
        VectorArray result = a.emptyLike(a.len());
        for (int i = 0; i < a.len(); i++) {
            VectorArray v = a.copy(i);
            double initialNorm = norm(v, product);
            if (initialNorm <= atol) {
                log.debug("Removing vector {} of norm {}", i, initialNorm);
                continue;
            }
            double currentNorm = initialNorm;
            // two passes: the second one cleans up cancellation errors of the first
            for (int pass = 0; pass < 2 && result.len() > 0; pass++) {
                double[][] coeffs = inner(v, result, product);
                v.subtract(result.lincomb(coeffs));
                double newNorm = norm(v, product);
                if (newNorm < rtol * currentNorm || newNorm <= atol) {
                    currentNorm = 0.0;
                    break;
                }
                currentNorm = newNorm;
            }
            if (currentNorm == 0.0) {
                log.debug("Removing linearly dependent vector {}", i);
                continue;
            }
            v.scal(1.0 / currentNorm);
            result.append(v, true);
        }
        return result;
    }

    /**
     * Largest deviation of the Gram matrix of {@code a} from the identity.
     */
    public static double orthonormalityError(VectorArray a, InnerProduct product) {
        double[][] g = product == null ? a.gramian() : product.apply2(a, a);
        double err = 0.0;
        for (int i = 0; i < g.length; i++) {
            for (int j = 0; j < g.length; j++)
                err = Math.max(err, Math.abs(g[i][j] - (i == j ? 1.0 : 0.0)));
        }
        return err;
    }

    private static double[][] inner(VectorArray v, VectorArray basis, InnerProduct product) {
        return product == null ? v.dot(basis) : product.apply2(v, basis);
    }

    private static double norm(VectorArray v, InnerProduct product) {
        if (product == null)
            return v.l2Norm()[0];
        return Math.sqrt(Math.max(product.apply2(v, v)[0][0], 0.0));
    }
}
