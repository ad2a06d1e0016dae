package com.radoncal.server.radon;

import com.radoncal.server.imaging.ImageOps;

/**
 * Sinogram of one image and the orientation read from it.
 * <p>
 * {@code sinogram[offset][angleIndex]}: rows are projection offsets, columns
 * are candidate angles spaced evenly over [0, 180] degrees.
 */
public class RadonTransformResult {
    private final double[][] maskedImage;
    private final double[][] sinogram;
    private final int rotation;

    public RadonTransformResult(double[][] maskedImage, double[][] sinogram) {
        this.maskedImage = maskedImage;
        this.sinogram = sinogram;
        this.rotation = computeRotation(sinogram);
    }

    public double[][] getMaskedImage() {
        return maskedImage;
    }

    public double[][] getSinogram() {
        return sinogram;
    }

    public int getFineness() {
        return sinogram[0].length;
    }

    /**
     * Major-axis angle in whole degrees, in [0, 180). Taken from the column of
     * the sinogram's global maximum; ties resolve to the first maximum in
     * row-major order (lowest offset, then lowest angle). A sinogram with no
     * finite maximum (all NaN or -Infinity) is rejected at construction.
     */
    public int getRotation() {
        return rotation;
    }

    public int getOrthogonal() {
        return (rotation + 90) % 180;
    }

    static int computeRotation(double[][] sinogram) {
        int fineness = sinogram[0].length;
        int column = ImageOps.argmax(sinogram)[1];
        if (column < 0) {
            throw new IllegalStateException("Sinogram has no maximum, entries are all NaN or -Infinity");
        }
        long degrees = Math.round(column * 180.0 / (fineness - 1));
        return (int) (degrees % 180);
    }
}
