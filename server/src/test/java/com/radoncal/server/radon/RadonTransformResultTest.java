package com.radoncal.server.radon;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RadonTransformResultTest {

    @Test
    public void testTieBreakPrefersFirstMaximumInRowMajorOrder() {
        double[][] sinogram = {
                { 0.0, 2.0, 0.0, 2.0, 0.0 },
                { 2.0, 0.0, 0.0, 0.0, 0.0 }
        };
        // row 0, column 1 of 5 angles -> 45 degrees
        Assertions.assertEquals(45, RadonTransformResult.computeRotation(sinogram));
    }

    @Test
    public void testLastColumnWrapsToZero() {
        double[][] sinogram = {
                { 0.0, 0.0, 1.0 }
        };
        Assertions.assertEquals(0, RadonTransformResult.computeRotation(sinogram));
    }

    @Test
    public void testDegreeConversionRounds() {
        // column 1 of 8 angles: 180 / 7 = 25.7
        double[][] sinogram = { { 0, 1, 0, 0, 0, 0, 0, 0 } };
        Assertions.assertEquals(26, RadonTransformResult.computeRotation(sinogram));
    }

    @Test
    public void testOrthogonal() {
        RadonTransformResult result = new RadonTransformResult(new double[1][1],
                new double[][] { { 0, 0, 0, 1, 0 } });
        Assertions.assertEquals(135, result.getRotation());
        Assertions.assertEquals(45, result.getOrthogonal());
    }

    @Test
    public void testAllNaNSinogramIsRejected() {
        double[][] sinogram = {
                { Double.NaN, Double.NaN, Double.NaN },
                { Double.NaN, Double.NaN, Double.NaN }
        };
        IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
                () -> new RadonTransformResult(new double[2][2], sinogram));
        Assertions.assertTrue(e.getMessage().contains("NaN"));
    }
}
