package com.radoncal.util;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;

/**
 * Big-endian raw double encoding used for band raster files.
 */
public class DoubleArrayCodec {

    public static byte[] toBytes(double[] values) {
        if (values == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES);
        buffer.asDoubleBuffer().put(values);
        return buffer.array();
    }

    public static double[] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        if (bytes.length % Double.BYTES != 0) {
            throw new IllegalArgumentException("Byte length " + bytes.length + " is not a multiple of "
                    + Double.BYTES);
        }
        DoubleBuffer buffer = ByteBuffer.wrap(bytes).asDoubleBuffer();
        double[] values = new double[buffer.remaining()];
        buffer.get(values);
        return values;
    }

    /**
     * Concatenates square rasters, row by row, into one flat array.
     */
    public static double[] flatten(double[][][] rasters) {
        int total = 0;
        for (double[][] raster : rasters) {
            for (double[] row : raster) {
                total += row.length;
            }
        }
        double[] flat = new double[total];
        int pos = 0;
        for (double[][] raster : rasters) {
            for (double[] row : raster) {
                System.arraycopy(row, 0, flat, pos, row.length);
                pos += row.length;
            }
        }
        return flat;
    }

    /**
     * Splits a flat array into {@code count} square rasters of equal size.
     */
    public static double[][][] unflatten(double[] flat, int count) {
        if (count <= 0 || flat.length % count != 0) {
            throw new IllegalArgumentException(flat.length + " values cannot be split into " + count + " rasters");
        }
        int perRaster = flat.length / count;
        int size = (int) Math.round(Math.sqrt(perRaster));
        if (size * size != perRaster) {
            throw new IllegalArgumentException("Raster of " + perRaster + " values is not square");
        }
        double[][][] rasters = new double[count][size][size];
        int pos = 0;
        for (int b = 0; b < count; b++) {
            for (int r = 0; r < size; r++) {
                System.arraycopy(flat, pos, rasters[b][r], 0, size);
                pos += size;
            }
        }
        return rasters;
    }
}
