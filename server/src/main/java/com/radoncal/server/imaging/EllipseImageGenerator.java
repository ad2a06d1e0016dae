package com.radoncal.server.imaging;

import com.radoncal.server.imaging.augment.ImageTransforms;

import java.util.Random;

/**
 * Draws synthetic elliptical sources with a known major-axis angle.
 * <p>
 * Angles follow the estimator convention: degrees measured clockwise from the
 * +x (column) axis as the image is displayed with row 0 at the top.
 */
public class EllipseImageGenerator {

    private final int size;
    private final double blurSigma;
    private final double noiseIntensity;
    private final Random random;

    public EllipseImageGenerator(int size, double blurSigma, double noiseIntensity, long seed) {
        this.size = size;
        this.blurSigma = blurSigma;
        this.noiseIntensity = noiseIntensity;
        this.random = new Random(seed);
    }

    /**
     * A noiseless generator with the reference blur of 1 pixel.
     */
    public static EllipseImageGenerator noiseless(int size) {
        return new EllipseImageGenerator(size, 1.0, 0.0, 42L);
    }

    public double[][] generate(double majorRadius, double minorRadius, double angleDegrees) {
        double theta = Math.toRadians(angleDegrees);
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);
        int center = size / 2;

        double[][] canvas = new double[size][size];
        for (int r = 0; r < size; r++) {
            double dy = r - center;
            for (int c = 0; c < size; c++) {
                double dx = c - center;
                double along = dx * cos + dy * sin;
                double across = -dx * sin + dy * cos;
                double d = (along * along) / (majorRadius * majorRadius)
                        + (across * across) / (minorRadius * minorRadius);
                if (d <= 1.0) {
                    canvas[r][c] = 1.0;
                }
            }
        }

        canvas = ImageTransforms.gaussianBlur(canvas, blurSigma);
        double max = ImageOps.max(canvas);
        if (max > 0) {
            ImageOps.scaleInPlace(canvas, 1.0 / max);
        }

        if (noiseIntensity > 0) {
            for (double[] row : canvas) {
                for (int c = 0; c < row.length; c++) {
                    row[c] += random.nextGaussian() * noiseIntensity;
                }
            }
        }

        double min = ImageOps.min(canvas);
        if (min < 0) {
            ImageOps.addInPlace(canvas, Math.abs(min));
        }
        return canvas;
    }

    /**
     * An ellipse with radii drawn uniformly from the given bounds and an
     * integer angle in [0, 180).
     */
    public Ellipse generateRandom(double minMajor, double maxMajor, double minMinor, double maxMinor) {
        double major = minMajor + random.nextDouble() * (maxMajor - minMajor);
        double minor = minMinor + random.nextDouble() * (maxMinor - minMinor);
        int angle = random.nextInt(180);
        return new Ellipse(generate(major, minor, angle), major, minor, angle);
    }

    public int getSize() {
        return size;
    }

    public static class Ellipse {
        private final double[][] pixels;
        private final double majorRadius;
        private final double minorRadius;
        private final int angleDegrees;

        public Ellipse(double[][] pixels, double majorRadius, double minorRadius, int angleDegrees) {
            this.pixels = pixels;
            this.majorRadius = majorRadius;
            this.minorRadius = minorRadius;
            this.angleDegrees = angleDegrees;
        }

        public double[][] getPixels() {
            return pixels;
        }

        public double getMajorRadius() {
            return majorRadius;
        }

        public double getMinorRadius() {
            return minorRadius;
        }

        public int getAngleDegrees() {
            return angleDegrees;
        }
    }
}
