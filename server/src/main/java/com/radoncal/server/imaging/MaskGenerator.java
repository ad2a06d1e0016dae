package com.radoncal.server.imaging;

public interface MaskGenerator {
    /**
     * Builds the aperture mask for an image of the given shape;
     * {@code true} marks pixels inside the region of interest.
     */
    boolean[][] generate(int height, int width);

    /**
     * Returns a copy of the image with every pixel outside the aperture zeroed.
     */
    default double[][] apply(double[][] image) {
        boolean[][] mask = generate(image.length, image[0].length);
        double[][] out = new double[image.length][image[0].length];
        for (int r = 0; r < image.length; r++) {
            for (int c = 0; c < image[r].length; c++) {
                out[r][c] = mask[r][c] ? image[r][c] : 0.0;
            }
        }
        return out;
    }
}
