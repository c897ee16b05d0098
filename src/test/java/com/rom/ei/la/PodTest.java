package com.rom.ei.la;

import com.rom.ei.api.DimensionMismatchException;
import com.rom.ei.api.InvalidConfigurationException;
import com.rom.ei.api.VectorArray;
import org.junit.Test;

import static org.junit.Assert.*;

public class PodTest {

    private static DenseVectorArray snapshots() {
        return DenseVectorArray.of(
                new double[] { 1.0, 2.0, 0.0, 1.0, 0.5 },
                new double[] { 0.0, 1.0, 3.0, 1.0, -1.0 },
                new double[] { 2.0, 0.0, 1.0, 4.0, 0.0 },
                new double[] { 1.0, 3.0, 3.0, 2.0, -0.5 }); // = first + second
    }

    @Test
    public void testModesAreOrthonormal() {
        VectorArray pod = Pod.pod(snapshots(), null, null);
        // the fourth snapshot is dependent
        assertEquals(3, pod.len());
        assertTrue(GramSchmidt.orthonormalityError(pod, null) < 1e-10);
    }

    @Test
    public void testModesLimit() {
        VectorArray pod = Pod.pod(snapshots(), 2, null);
        assertEquals(2, pod.len());
    }

    @Test
    public void testRankOneDataYieldsOneMode() {
        DenseVectorArray data = DenseVectorArray.of(
                new double[] { 1.0, 2.0, 3.0 },
                new double[] { 2.0, 4.0, 6.0 },
                new double[] { -0.5, -1.0, -1.5 });
        VectorArray pod = Pod.pod(data, 2, null);
        assertEquals(1, pod.len());
        double[] mode = ((DenseVectorArray) pod).toArray(0);
        double n = Math.sqrt(14.0);
        assertEquals(1.0 / n, Math.abs(mode[0]), 1e-12);
        assertEquals(3.0 / n, Math.abs(mode[2]), 1e-12);
    }

    @Test
    public void testFirstModeCapturesDominantDirection() {
        DenseVectorArray data = DenseVectorArray.of(
                new double[] { 10.0, 0.0, 0.1 },
                new double[] { -9.0, 0.1, 0.0 },
                new double[] { 11.0, 0.0, -0.1 });
        double[] mode = ((DenseVectorArray) Pod.pod(data, 1, null)).toArray(0);
        assertEquals(1.0, Math.abs(mode[0]), 1e-3);
    }

    @Test
    public void testOrthonormalWithRespectToProduct() {
        MatrixInnerProduct product = MatrixInnerProduct.diagonal(1.0, 2.0, 3.0, 4.0, 5.0);
        VectorArray pod = Pod.pod(snapshots(), null, product);
        assertEquals(3, pod.len());
        assertTrue(GramSchmidt.orthonormalityError(pod, product) < 1e-10);
        assertTrue(GramSchmidt.orthonormalityError(pod, null) > 1e-3);
    }

    @Test
    public void testSingularValuesDecrease() {
        double[] sv = Pod.singularValues(snapshots(), null);
        assertEquals(4, sv.length);
        for (int i = 1; i < sv.length; i++)
            assertTrue(sv[i] <= sv[i - 1]);
        assertTrue(sv[3] < 1e-6);
    }

    @Test(expected = DimensionMismatchException.class)
    public void testEmptySnapshotsAreRejected() {
        Pod.pod(DenseVectorArray.empty(3), null, null);
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testNonPositiveModesAreRejected() {
        Pod.pod(snapshots(), 0, null);
    }

    @Test
    public void testZeroDataGivesEmptyBasis() {
        VectorArray pod = Pod.pod(DenseVectorArray.zeros(3, 2), null, null);
        assertEquals(0, pod.len());
        assertEquals(3, pod.dim());
    }
}
