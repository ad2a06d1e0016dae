package com.radoncal.server.imaging;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class CircleMaskGeneratorTest {

    private final CircleMaskGenerator generator = new CircleMaskGenerator();

    @Test
    public void testCenterAndCornersOf40x40() {
        boolean[][] mask = generator.generate(40, 40);

        Assertions.assertTrue(mask[20][20]);
        Assertions.assertTrue(mask[0][20], "top of the circle touches row 0");
        Assertions.assertTrue(mask[20][0]);
        Assertions.assertFalse(mask[0][0]);
        Assertions.assertFalse(mask[39][39]);
        Assertions.assertFalse(mask[0][39]);
    }

    @Test
    public void testRadiusBoundary() {
        boolean[][] mask = generator.generate(40, 40);
        // (20 + 12, 20 + 16): 144 + 256 = 400 = 20^2 -> inside
        Assertions.assertTrue(mask[32][36]);
        // (20 + 13, 20 + 16): 169 + 256 > 400 -> outside
        Assertions.assertFalse(mask[33][36]);
    }

    @Test
    public void testApplyZeroesOutside() {
        double[][] image = new double[10][10];
        for (double[] row : image) {
            java.util.Arrays.fill(row, 2.0);
        }
        double[][] masked = generator.apply(image);

        Assertions.assertEquals(0.0, masked[0][0]);
        Assertions.assertEquals(2.0, masked[5][5]);
        Assertions.assertEquals(2.0, image[0][0], "input must not be modified");
    }

    @Test
    public void testDeterministic() {
        boolean[][] a = generator.generate(17, 23);
        boolean[][] b = generator.generate(17, 23);
        for (int r = 0; r < 17; r++) {
            Assertions.assertArrayEquals(a[r], b[r]);
        }
    }
}
