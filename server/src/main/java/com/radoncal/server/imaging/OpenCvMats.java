package com.radoncal.server.imaging;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions between row-major {@code double[row][col]} rasters and
 * single-channel {@code CV_64F} mats. Loads the bundled OpenCV native
 * library the first time the class is used.
 */
public class OpenCvMats {
    private static final Logger logger = LoggerFactory.getLogger(OpenCvMats.class);

    static {
        nu.pattern.OpenCV.loadLocally();
        logger.info("Loaded OpenCV {}", org.opencv.core.Core.VERSION);
    }

    public static Mat toMat(double[][] raster) {
        int rows = raster.length;
        int cols = rows == 0 ? 0 : raster[0].length;
        Mat mat = new Mat(rows, cols, CvType.CV_64F);
        double[] flat = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (raster[r].length != cols) {
                mat.release();
                throw new IllegalArgumentException("Ragged raster: row " + r + " has " + raster[r].length
                        + " columns, expected " + cols);
            }
            System.arraycopy(raster[r], 0, flat, r * cols, cols);
        }
        mat.put(0, 0, flat);
        return mat;
    }

    public static double[][] toArray(Mat mat) {
        if (mat.type() != CvType.CV_64F) {
            throw new IllegalArgumentException("Expected a CV_64F mat, got type " + mat.type());
        }
        int rows = mat.rows();
        int cols = mat.cols();
        double[] flat = new double[rows * cols];
        mat.get(0, 0, flat);
        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(flat, r * cols, out[r], 0, cols);
        }
        return out;
    }
}
