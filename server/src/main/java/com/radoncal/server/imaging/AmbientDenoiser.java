package com.radoncal.server.imaging;

/**
 * Subtracts the mean brightness of the background (pixels outside the mask)
 * and clamps at zero.
 * <p>
 * When the mask leaves no background pixels the noise floor is taken as 0 and
 * the image is only clamped.
 */
public class AmbientDenoiser implements Denoiser {

    @Override
    public double[][] denoise(double[][] image, boolean[][] mask) {
        if (mask.length != image.length || mask[0].length != image[0].length) {
            throw new IllegalArgumentException("Mask shape " + mask.length + "x" + mask[0].length
                    + " does not match image shape " + image.length + "x" + image[0].length);
        }

        double ambientNoise = ambientNoise(image, mask);

        double[][] out = new double[image.length][image[0].length];
        for (int r = 0; r < image.length; r++) {
            for (int c = 0; c < image[r].length; c++) {
                double v = image[r][c] - ambientNoise;
                out[r][c] = v < 0 ? 0.0 : v;
            }
        }
        return out;
    }

    double ambientNoise(double[][] image, boolean[][] mask) {
        double sum = 0.0;
        int count = 0;
        for (int r = 0; r < image.length; r++) {
            for (int c = 0; c < image[r].length; c++) {
                if (!mask[r][c]) {
                    sum += image[r][c];
                    count++;
                }
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }
}
