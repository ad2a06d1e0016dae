package com.radoncal.server.pipeline;

import com.radoncal.server.error.RunningErrorCalculator;

/**
 * What one band contributes to the backlog: its oracle angle and the error
 * of the estimator over the band's augmentations.
 */
public class CalibrationResult {
    private final int oracleAngle;
    private final RunningErrorCalculator error;

    public CalibrationResult(int oracleAngle, RunningErrorCalculator error) {
        this.oracleAngle = oracleAngle;
        this.error = error;
    }

    public int getOracleAngle() {
        return oracleAngle;
    }

    public RunningErrorCalculator getError() {
        return error;
    }

    @Override
    public String toString() {
        return "CalibrationResult{oracle=" + oracleAngle + ", error=" + error + "}";
    }
}
