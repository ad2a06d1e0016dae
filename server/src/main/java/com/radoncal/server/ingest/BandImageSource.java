package com.radoncal.server.ingest;

import com.radoncal.server.imaging.BandImage;

import java.io.IOException;

public interface BandImageSource {
    /**
     * Loads one band of one source, validated and shifted to be non-negative.
     *
     * @throws InvalidBandException if the band's data is unusable
     * @throws IOException          if the source cannot be read
     */
    BandImage load(String sourceId, String binId, String band) throws IOException, InvalidBandException;
}
