package com.radoncal.server.error;

/**
 * Angular distance on the half-turn: orientations 0 and 180 degrees are the
 * same axis.
 */
public final class CircularError {

    private CircularError() {
    }

    /**
     * Folds a raw angle difference into [0, 90].
     */
    public static double fold(double difference) {
        double d = Math.abs(difference) % 180.0;
        return Math.min(d, 180.0 - d);
    }

    public static double between(double expected, double actual) {
        return fold(expected - actual);
    }
}
