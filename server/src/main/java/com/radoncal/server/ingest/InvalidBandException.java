package com.radoncal.server.ingest;

/**
 * The band exists but its data cannot be used (empty, all zero, or
 * non-finite).
 */
public class InvalidBandException extends Exception {
    public InvalidBandException(String message) {
        super(message);
    }
}
