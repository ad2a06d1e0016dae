package com.radoncal.server.error;

import java.util.Locale;

/**
 * Running sum of circular estimation errors for one band.
 * <p>
 * Only grows: {@link #update} and {@link #merge} add to both fields, which
 * lets partial results from different workers be combined in any order. Not
 * thread-safe; each worker owns its own instance.
 */
public class RunningErrorCalculator {
    private double totalError;
    private int runningCount;

    public RunningErrorCalculator() {
        this(0.0, 0);
    }

    public RunningErrorCalculator(double totalError, int runningCount) {
        if (totalError < 0 || runningCount < 0) {
            throw new IllegalArgumentException(
                    "Running error must be non-negative, got " + totalError + "/" + runningCount);
        }
        this.totalError = totalError;
        this.runningCount = runningCount;
    }

    /**
     * Records one estimate and returns its folded error in [0, 90].
     */
    public double update(double expectedRotation, double actualRotation) {
        double error = CircularError.between(expectedRotation, actualRotation);
        totalError += error;
        runningCount++;
        return error;
    }

    public double getAverage() {
        if (runningCount <= 0) {
            throw new NoErrorDataException("No errors have been recorded");
        }
        return totalError / runningCount;
    }

    public RunningErrorCalculator merge(RunningErrorCalculator other) {
        totalError += other.totalError;
        runningCount += other.runningCount;
        return this;
    }

    public double getTotalError() {
        return totalError;
    }

    public int getRunningCount() {
        return runningCount;
    }

    @Override
    public String toString() {
        if (runningCount == 0) {
            return "n/a (0/0)";
        }
        return String.format(Locale.ROOT, "%.3f (%d/%d)", getAverage(), (long) totalError, runningCount);
    }
}
