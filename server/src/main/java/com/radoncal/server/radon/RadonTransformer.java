package com.radoncal.server.radon;

import com.radoncal.server.imaging.ImageOps;
import com.radoncal.server.imaging.MaskGenerator;
import com.radoncal.server.imaging.OpenCvMats;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * Projective Radon transform used to estimate a source's major-axis angle.
 * <p>
 * For each candidate angle the masked image is rotated about its center by a
 * homogeneous transform ({@code Imgproc.warpPerspective}, bilinear, zero
 * outside the canvas) and summed along one axis ({@code Core.reduce}). An
 * elongated source concentrates the most flux into one projection bin when
 * the integration lines run along its major axis, so the column holding the
 * sinogram's maximum is the orientation estimate.
 */
public class RadonTransformer {

    public static final int DEFAULT_FINENESS = 181;

    private final MaskGenerator maskGenerator;
    private final int fineness;

    public RadonTransformer(MaskGenerator maskGenerator, int fineness) {
        if (fineness < 2) {
            throw new IllegalArgumentException("Fineness must be at least 2, got " + fineness);
        }
        this.maskGenerator = maskGenerator;
        this.fineness = fineness;
    }

    public RadonTransformer(MaskGenerator maskGenerator) {
        this(maskGenerator, DEFAULT_FINENESS);
    }

    public RadonTransformResult transform(double[][] rawImage) {
        return transform(rawImage, fineness);
    }

    public RadonTransformResult transform(double[][] rawImage, int fineness) {
        if (!ImageOps.isSquare(rawImage)) {
            int width = rawImage.length == 0 ? 0 : rawImage[0].length;
            throw new IllegalArgumentException(
                    "The image must be a square, got " + rawImage.length + "x" + width + " instead");
        }
        if (fineness < 2) {
            throw new IllegalArgumentException("Fineness must be at least 2, got " + fineness);
        }

        double[][] image = maskGenerator.apply(rawImage);
        int size = image.length;
        double center = size / 2;

        double[][] sinogram = new double[size][fineness];
        Mat src = OpenCvMats.toMat(image);
        Mat warped = new Mat();
        Mat projection = new Mat();
        try {
            for (int i = 0; i < fineness; i++) {
                double theta = Math.PI * i / (fineness - 1);
                double[][] matrix = rotationAbout(center, Math.cos(theta), Math.sin(theta));
                project(src, matrix, warped, projection);
                for (int x = 0; x < size; x++) {
                    sinogram[x][i] = projection.get(0, x)[0];
                }
            }
        } finally {
            src.release();
            warped.release();
            projection.release();
        }
        return new RadonTransformResult(image, sinogram);
    }

    /**
     * 3x3 homogeneous matrix rotating by theta about (center, center):
     * <pre>
     * [ cos  sin  -c(cos + sin - 1) ]
     * [-sin  cos  -c(cos - sin - 1) ]
     * [  0    0          1          ]
     * </pre>
     */
    static double[][] rotationAbout(double center, double cos, double sin) {
        return new double[][] {
                { cos, sin, -center * (cos + sin - 1) },
                { -sin, cos, -center * (cos - sin - 1) },
                { 0, 0, 1 }
        };
    }

    /**
     * Maps every output coordinate (x, y) through the matrix, samples the
     * image at row x', column y' and sums over y. The result is a 1 x size
     * row whose entry x is the line integral for offset x.
     */
    private static void project(Mat image, double[][] m, Mat warped, Mat projection) {
        // OpenCV reads (column, row), so the first two matrix rows trade places
        double[][] swapped = { m[1], m[0], m[2] };
        Mat inverseMap = OpenCvMats.toMat(swapped);
        try {
            Imgproc.warpPerspective(image, warped, inverseMap, image.size(),
                    Imgproc.INTER_LINEAR | Imgproc.WARP_INVERSE_MAP, Core.BORDER_CONSTANT, new Scalar(0));
        } finally {
            inverseMap.release();
        }
        Core.reduce(warped, projection, 0, Core.REDUCE_SUM, CvType.CV_64F);
    }

    public MaskGenerator getMaskGenerator() {
        return maskGenerator;
    }

    public int getFineness() {
        return fineness;
    }
}
