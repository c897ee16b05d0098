package com.rom.ei.algorithms;

import com.rom.ei.api.DimensionMismatchException;
import com.rom.ei.api.GreedyListener;
import com.rom.ei.api.InvalidConfigurationException;
import com.rom.ei.api.StopReason;
import com.rom.ei.api.VectorArray;
import com.rom.ei.la.DenseVectorArray;
import com.rom.ei.la.MatrixInnerProduct;
import com.rom.ei.util.CompositeGreedyListener;
import com.rom.ei.util.ErrorDecayListener;
import com.rom.ei.util.ErrorNorms;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class EiGreedyTest {

    private static DenseVectorArray independent() {
        return DenseVectorArray.of(
                new double[] { 1.0, 2.0, 0.0, 1.0 },
                new double[] { 0.0, 1.0, 3.0, 1.0 },
                new double[] { 2.0, 0.0, 1.0, 4.0 });
    }

    private static EiGreedyConfig config(Projection projection, Double target, Integer maxDofs) {
        return EiGreedyConfig.builder()
                .projection(projection)
                .targetError(target)
                .maxInterpolationDofs(maxDofs)
                .build();
    }

    @Test
    public void testConvergesOnIndependentVectors() {
        for (Projection p : Projection.values()) {
            DenseVectorArray u = independent();
            GreedyResult result = EiGreedy.run(u, config(p, 1e-12, null));

            assertEquals(StopReason.CONVERGED, result.history().stopReason());
            assertTrue(result.size() <= 3);
            assertArrayEquals(new int[] { 3, 2, 1 }, result.dofs());
            assertEquals(3, result.history().errors().size());
            assertNull(result.history().finalError());

            // the interpolant reproduces every evaluation
            GreedyState state = new GreedyState(u.emptyLike(3));
            VectorArray basis = result.basis();
            for (int i = 0; i < basis.len(); i++)
                state.extend(basis.copy(i), result.dofs()[i]);
            VectorArray residual = u.copy();
            residual.subtract(state.interpolate(u, new int[] { 0, 1, 2 }));
            for (double e : residual.l2Norm())
                assertTrue(p + ": " + e, e <= 1e-12);
        }
    }

    @Test
    public void testBasisIsNormalizedAtItsDofs() {
        GreedyResult result = EiGreedy.run(independent(), config(Projection.ORTHOGONAL, 1e-12, null));
        int[] dofs = result.dofs();
        double[][] c = result.basis().components(dofs);
        for (int j = 0; j < dofs.length; j++) {
            assertEquals(1.0, c[j][j], 1e-15);
            // later vectors vanish at earlier DOFs
            for (int i = 0; i < j; i++)
                assertEquals(0.0, c[j][i], 1e-12);
        }
        for (double t : result.history().triangularityErrors())
            assertTrue(t < 1e-12);
        assertEquals(0.5, ((DenseVectorArray) result.basis()).get(0, 0), 1e-15);
    }

    @Test
    public void testOrthogonalErrorIsNeverLarger() {
        List<Double> orthogonal = EiGreedy.run(independent(), config(Projection.ORTHOGONAL, 1e-12, null))
                .history().errors();
        List<Double> ei = EiGreedy.run(independent(), config(Projection.EI, 1e-12, null))
                .history().errors();
        assertEquals(Math.sqrt(21.0), orthogonal.get(0), 1e-14);
        assertEquals(orthogonal.get(0), ei.get(0), 0.0);
        assertTrue(orthogonal.get(1) < ei.get(1));
        assertEquals(2.943920288775949, orthogonal.get(1), 1e-12);
        assertEquals(2.968585521759479, ei.get(1), 1e-12);
    }

    @Test
    public void testSingleBasisVectorErrorsCoincide() {
        DenseVectorArray u = DenseVectorArray.of(
                new double[] { 3.0, 0.0, 0.0, 0.0 },
                new double[] { 0.0, 2.0, 1.0, 0.0 },
                new double[] { 0.0, 0.0, 1.0, 1.0 });
        GreedyResult orthogonal = EiGreedy.run(u, config(Projection.ORTHOGONAL, null, 1));
        GreedyResult ei = EiGreedy.run(u, config(Projection.EI, null, 1));

        for (GreedyResult r : List.of(orthogonal, ei)) {
            assertEquals(StopReason.MAX_DOFS_REACHED, r.history().stopReason());
            assertArrayEquals(new int[] { 0 }, r.dofs());
            assertEquals(3.0, r.history().errors().get(0), 0.0);
        }
        assertEquals(Math.sqrt(5.0), orthogonal.history().finalError(), 1e-15);
        assertEquals(orthogonal.history().finalError(), ei.history().finalError(), 1e-15);
    }

    @Test
    public void testMaxDofsReportsFinalError() {
        GreedyResult full = EiGreedy.run(independent(), config(Projection.ORTHOGONAL, 1e-12, null));
        GreedyResult limited = EiGreedy.run(independent(), config(Projection.ORTHOGONAL, null, 2));

        assertEquals(StopReason.MAX_DOFS_REACHED, limited.history().stopReason());
        assertEquals(2, limited.size());
        assertEquals(2, limited.basis().len());
        assertEquals(full.history().errors().subList(0, 2), limited.history().errors());
        assertEquals(full.history().errors().get(2), limited.history().finalError(), 1e-12);
    }

    @Test
    public void testDofCollision() {
        // second vector is a multiple of the first
        DenseVectorArray u = DenseVectorArray.of(new double[] { 2.0, 1.0, 0.0 }, new double[] { 1.0, 0.5, 0.0 });
        GreedyResult result = EiGreedy.run(u, config(Projection.ORTHOGONAL, null, null));

        assertEquals(StopReason.DOF_COLLISION, result.history().stopReason());
        assertArrayEquals(new int[] { 0 }, result.dofs());
        assertEquals(1, result.basis().len());
        assertEquals(1, result.history().errors().size());
    }

    @Test
    public void testVanishingCandidateStops() {
        DenseVectorArray u = DenseVectorArray.of(new double[] { 0.0, 2.0, 1.0 }, new double[] { 0.0, 1.0, 0.5 });
        ErrorDecayListener listener = new ErrorDecayListener();
        GreedyResult result = EiGreedy.run(u, EiGreedyConfig.builder().listener(listener).build());

        assertEquals(StopReason.CANDIDATE_VANISHED, result.history().stopReason());
        assertEquals(StopReason.CANDIDATE_VANISHED, listener.stopReason());
        assertArrayEquals(new int[] { 1 }, result.dofs());
        assertEquals(1, result.history().errors().size());
        assertNull(result.history().finalError());
    }

    @Test
    public void testTargetErrorWinsOverVanishingCandidate() {
        DenseVectorArray u = DenseVectorArray.of(new double[] { 0.0, 2.0, 1.0 }, new double[] { 0.0, 1.0, 0.5 });
        GreedyResult result = EiGreedy.run(u, config(Projection.EI, 1e-12, null));

        assertEquals(StopReason.CONVERGED, result.history().stopReason());
        assertArrayEquals(new int[] { 1 }, result.dofs());
    }

    @Test
    public void testListenerSeesEveryIteration() {
        ErrorDecayListener decay = new ErrorDecayListener();
        List<Integer> basisSizes = new ArrayList<>();
        GreedyListener sizes = new GreedyListener() {
            @Override
            public void onExtended(int[] dofs, VectorArray basis, double triangularityError) {
                assertEquals(dofs.length, basis.len());
                basisSizes.add(dofs.length);
            }
        };
        EiGreedyConfig cfg = EiGreedyConfig.builder()
                .targetError(1e-12)
                .listener(new CompositeGreedyListener(decay, sizes))
                .build();

        GreedyResult result = EiGreedy.run(independent(), cfg);

        assertEquals(StopReason.CONVERGED, decay.stopReason());
        assertEquals(result.size() + 1, decay.estimates().size());
        assertEquals(result.history().errors(), decay.estimates().subList(0, result.size()));
        assertTrue(decay.estimates().get(result.size()) <= 1e-12);
        assertEquals(List.of(1, 2, 3), basisSizes);
    }

    @Test
    public void testBatchesGiveSameResultAsSingleArray() {
        DenseVectorArray all = independent();
        List<VectorArray> batches = List.of(all.copy(0, 1), DenseVectorArray.empty(4), all.copy(2));
        GreedyResult single = EiGreedy.run(all, config(Projection.EI, 1e-12, null));
        GreedyResult split = EiGreedy.run(batches, config(Projection.EI, 1e-12, null));

        assertArrayEquals(single.dofs(), split.dofs());
        assertEquals(single.history().errors(), split.history().errors());
    }

    @Test
    public void testSupNorm() {
        EiGreedyConfig cfg = EiGreedyConfig.builder()
                .projection(Projection.EI)
                .errorNorm(ErrorNorms.SUP)
                .targetError(1e-12)
                .build();
        GreedyResult result = EiGreedy.run(independent(), cfg);
        assertEquals(StopReason.CONVERGED, result.history().stopReason());
        assertEquals(4.0, result.history().errors().get(0), 0.0);
    }

    @Test
    public void testWeightedOrthogonalProjection() {
        EiGreedyConfig cfg = EiGreedyConfig.builder()
                .product(MatrixInnerProduct.diagonal(1.0, 2.0, 3.0, 4.0))
                .targetError(1e-10)
                .build();
        GreedyResult result = EiGreedy.run(independent(), cfg);
        assertEquals(StopReason.CONVERGED, result.history().stopReason());
        assertEquals(3, result.size());
    }

    @Test
    public void testEvaluationsAreNotModified() {
        DenseVectorArray u = independent();
        EiGreedy.run(u, config(Projection.ORTHOGONAL, 1e-12, null));
        assertArrayEquals(independent().toMatrix()[2], u.toMatrix()[2], 0.0);
        assertEquals(3, u.len());
    }

    @Test
    public void testNoEvaluationsAreRejected() {
        try {
            EiGreedy.run(DenseVectorArray.empty(4), EiGreedyConfig.defaults());
            fail("Should throw DimensionMismatchException for empty evaluations");
        } catch (DimensionMismatchException e) {
            assertTrue(e.getMessage().contains("empty"));
        }
        try {
            EiGreedy.run(List.of(), EiGreedyConfig.defaults());
            fail("Should throw DimensionMismatchException for an empty list");
        } catch (DimensionMismatchException e) {
            // Expected
        }
    }

    @Test(expected = DimensionMismatchException.class)
    public void testIncompatibleBatchesAreRejected() {
        EiGreedy.run(List.of(independent(), DenseVectorArray.of(new double[] { 1.0, 2.0 })),
                EiGreedyConfig.defaults());
    }

    @Test
    public void testInvalidConfiguration() {
        try {
            EiGreedyConfig.builder().projection(Projection.EI).product(MatrixInnerProduct.diagonal(1.0)).build();
            fail("Inner product with ei projection should be rejected");
        } catch (InvalidConfigurationException e) {
            assertTrue(e.getMessage().contains("orthogonal"));
        }
        try {
            EiGreedyConfig.builder().maxInterpolationDofs(0).build();
            fail("Zero DOFs should be rejected");
        } catch (InvalidConfigurationException e) {
            // Expected
        }
        try {
            EiGreedyConfig.builder().targetError(-1.0).build();
            fail("Negative target error should be rejected");
        } catch (InvalidConfigurationException e) {
            // Expected
        }
        try {
            EiGreedyConfig.builder().projection("galerkin");
            fail("Unknown projection should be rejected");
        } catch (InvalidConfigurationException e) {
            assertTrue(e.getMessage().contains("galerkin"));
        }
    }
}
