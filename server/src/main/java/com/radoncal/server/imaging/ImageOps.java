package com.radoncal.server.imaging;

/**
 * Small helpers over row-major {@code double[row][col]} images.
 */
public class ImageOps {

    public static double[][] copy(double[][] image) {
        double[][] out = new double[image.length][];
        for (int r = 0; r < image.length; r++) {
            out[r] = image[r].clone();
        }
        return out;
    }

    public static boolean isSquare(double[][] image) {
        if (image.length == 0) {
            return false;
        }
        for (double[] row : image) {
            if (row.length != image.length) {
                return false;
            }
        }
        return true;
    }

    public static double min(double[][] image) {
        double min = Double.POSITIVE_INFINITY;
        for (double[] row : image) {
            for (double v : row) {
                if (v < min)
                    min = v;
            }
        }
        return min;
    }

    public static double max(double[][] image) {
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : image) {
            for (double v : row) {
                if (v > max)
                    max = v;
            }
        }
        return max;
    }

    public static void addInPlace(double[][] image, double delta) {
        for (double[] row : image) {
            for (int c = 0; c < row.length; c++) {
                row[c] += delta;
            }
        }
    }

    public static void scaleInPlace(double[][] image, double factor) {
        for (double[] row : image) {
            for (int c = 0; c < row.length; c++) {
                row[c] *= factor;
            }
        }
    }

    /**
     * Row-major index of the first maximum, returned as {row, col}.
     */
    public static int[] argmax(double[][] values) {
        int bestRow = -1;
        int bestCol = -1;
        double bestVal = Double.NEGATIVE_INFINITY;
        for (int r = 0; r < values.length; r++) {
            for (int c = 0; c < values[r].length; c++) {
                if (values[r][c] > bestVal) {
                    bestVal = values[r][c];
                    bestRow = r;
                    bestCol = c;
                }
            }
        }
        return new int[] { bestRow, bestCol };
    }
}
