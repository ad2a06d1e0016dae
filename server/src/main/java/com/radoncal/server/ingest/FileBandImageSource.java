package com.radoncal.server.ingest;

import com.radoncal.server.imaging.BandImage;
import com.radoncal.util.DoubleArrayCodec;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads sources stored as {@code <dataDir>/b<binId>/<sourceId>.bands}: the
 * {@link #BANDS} rasters one after another, each a square of big-endian
 * doubles.
 */
public class FileBandImageSource implements BandImageSource {

    public static final String BANDS = "griz";
    public static final String FILE_SUFFIX = ".bands";

    private final Path dataDirectory;

    public FileBandImageSource(String dataDirectory) {
        this.dataDirectory = Paths.get(dataDirectory);
    }

    @Override
    public BandImage load(String sourceId, String binId, String band) throws IOException, InvalidBandException {
        int bandIndex = band == null || band.length() != 1 ? -1 : BANDS.indexOf(band);
        if (bandIndex < 0) {
            throw new InvalidBandException("Unknown band '" + band + "' for source " + sourceId);
        }

        Path file = pathFor(dataDirectory, sourceId, binId);
        if (!Files.exists(file)) {
            throw new FileNotFoundException("No band file at " + file);
        }

        double[][][] rasters;
        try {
            rasters = DoubleArrayCodec.unflatten(DoubleArrayCodec.fromBytes(Files.readAllBytes(file)),
                    BANDS.length());
        } catch (IllegalArgumentException e) {
            throw new InvalidBandException("Malformed band file " + file + ": " + e.getMessage());
        }

        BandImage image = new BandImage(sourceId, band, rasters[bandIndex]);
        if (!image.isValid()) {
            throw new InvalidBandException("Band " + band + " of source " + sourceId
                    + " is empty or contains non-finite values");
        }
        return image.shiftedNonNegative();
    }

    public static Path pathFor(Path dataDirectory, String sourceId, String binId) {
        return dataDirectory.resolve("b" + binId).resolve(sourceId + FILE_SUFFIX);
    }

    /**
     * Writes the four band rasters of one source in the layout {@link #load}
     * reads.
     */
    public static Path write(Path dataDirectory, String sourceId, String binId, double[][][] rasters)
            throws IOException {
        if (rasters.length != BANDS.length()) {
            throw new IllegalArgumentException("Expected " + BANDS.length() + " rasters, got " + rasters.length);
        }
        Path file = pathFor(dataDirectory, sourceId, binId);
        Files.createDirectories(file.getParent());
        Files.write(file, DoubleArrayCodec.toBytes(DoubleArrayCodec.flatten(rasters)));
        return file;
    }
}
