package com.radoncal.server.imaging;

/**
 * Circular aperture centered on the image with a radius of half the shorter
 * side. Centers and radius use integer division, so a 40x40 image is
 * centered on pixel (20, 20) with radius 20.
 */
public class CircleMaskGenerator implements MaskGenerator {

    @Override
    public boolean[][] generate(int height, int width) {
        int centerRow = height / 2;
        int centerCol = width / 2;
        int radius = Math.min(height, width) / 2;
        long radiusSq = (long) radius * radius;

        boolean[][] mask = new boolean[height][width];
        for (int r = 0; r < height; r++) {
            long dy = r - centerRow;
            for (int c = 0; c < width; c++) {
                long dx = c - centerCol;
                mask[r][c] = dx * dx + dy * dy <= radiusSq;
            }
        }
        return mask;
    }
}
