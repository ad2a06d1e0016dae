package com.radoncal.server.imaging.augment;

import com.radoncal.server.imaging.ImageOps;
import com.radoncal.server.imaging.OpenCvMats;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.Random;

/**
 * The pixel-level operations behind each {@link Augmentation}. All of them
 * return a new array.
 */
public class ImageTransforms {

    /**
     * Rotates clockwise (as displayed, row 0 on top) by {@code angleDegrees}
     * about the image center, keeping the canvas size. Pixels that come from
     * outside the canvas read as zero. If interpolation leaves negative values
     * the whole image is lifted by the minimum.
     */
    public static double[][] rotateClockwise(double[][] image, double angleDegrees) {
        int height = image.length;
        int width = image[0].length;
        Point center = new Point(width / 2, height / 2);

        Mat src = OpenCvMats.toMat(image);
        // OpenCV angles are counter-clockwise
        Mat matrix = Imgproc.getRotationMatrix2D(center, -angleDegrees, 1.0);
        Mat dst = new Mat();
        double[][] out;
        try {
            Imgproc.warpAffine(src, dst, matrix, new Size(width, height), Imgproc.INTER_LINEAR,
                    Core.BORDER_CONSTANT, new Scalar(0));
            out = OpenCvMats.toArray(dst);
        } finally {
            src.release();
            matrix.release();
            dst.release();
        }

        double shift = ImageOps.min(out);
        if (shift < 0) {
            ImageOps.addInPlace(out, Math.abs(shift));
        }
        return out;
    }

    /**
     * Simulates shot noise: the image scaled by {@code brightnessModifier} is
     * a Poisson rate map, and each output pixel is the sum of
     * {@code sampleCount} independent draws at that rate.
     */
    public static double[][] resample(double[][] image, int sampleCount, double brightnessModifier,
            Random random) {
        if (ImageOps.min(image) < 0) {
            throw new IllegalArgumentException("Image data must be non-negative to resample");
        }
        if (sampleCount <= 0) {
            throw new IllegalArgumentException("Sample count must be positive, got " + sampleCount);
        }
        PoissonSampler sampler = new PoissonSampler(random);
        double[][] out = new double[image.length][image[0].length];
        for (int r = 0; r < image.length; r++) {
            for (int c = 0; c < image[r].length; c++) {
                double rate = brightnessModifier * image[r][c];
                // the sum of n independent Poisson(rate) draws is Poisson(n * rate)
                out[r][c] = sampler.sample(sampleCount * rate);
            }
        }
        return out;
    }

    /**
     * Isotropic Gaussian smoothing with the given sigma. OpenCV sizes the
     * kernel from sigma; edges are extended with the nearest pixel.
     */
    public static double[][] gaussianBlur(double[][] image, double sigma) {
        if (sigma <= 0) {
            return ImageOps.copy(image);
        }
        Mat src = OpenCvMats.toMat(image);
        Mat dst = new Mat();
        try {
            Imgproc.GaussianBlur(src, dst, new Size(0, 0), sigma, sigma, Core.BORDER_REPLICATE);
            return OpenCvMats.toArray(dst);
        } finally {
            src.release();
            dst.release();
        }
    }
}
