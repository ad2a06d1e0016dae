package com.radoncal.server.imaging;

/**
 * One spectral band of one source, as loaded from the archive.
 */
public class BandImage {
    // pixels[row][col], square for all supported sources
    private final double[][] pixels;
    private final String sourceId;
    private final String band;

    public BandImage(String sourceId, String band, double[][] pixels) {
        this.sourceId = sourceId;
        this.band = band;
        this.pixels = pixels;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getBand() {
        return band;
    }

    public double[][] getPixels() {
        return pixels;
    }

    /**
     * A band is unusable when it has no pixels, carries no signal at all, or
     * contains NaN/infinite values.
     */
    public boolean isValid() {
        if (pixels == null || pixels.length == 0 || pixels[0].length == 0) {
            return false;
        }
        boolean anyNonZero = false;
        for (double[] row : pixels) {
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    return false;
                }
                if (v != 0.0) {
                    anyNonZero = true;
                }
            }
        }
        return anyNonZero;
    }

    /**
     * Returns a copy lifted so that its minimum is zero when the raw data dips
     * below zero, otherwise an unchanged copy.
     */
    public BandImage shiftedNonNegative() {
        double[][] copy = ImageOps.copy(pixels);
        double shift = ImageOps.min(copy);
        if (shift < 0) {
            ImageOps.addInPlace(copy, Math.abs(shift));
        }
        return new BandImage(sourceId, band, copy);
    }

    @Override
    public String toString() {
        int size = pixels == null ? 0 : pixels.length;
        return "BandImage{source='" + sourceId + "', band='" + band + "', size=" + size + "}";
    }
}
