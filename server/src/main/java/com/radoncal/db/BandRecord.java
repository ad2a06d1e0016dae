package com.radoncal.db;

/**
 * Read model of one band row joined with its rotation statistics.
 */
public class BandRecord {
    private final long uid;
    private final String sourceId;
    private final String binId;
    private final String band;
    private final BandStatus status;
    private final int errorCount;
    private final Double degree;
    private final double totalError;
    private final int runningCount;

    public BandRecord(long uid, String sourceId, String binId, String band, BandStatus status, int errorCount,
            Double degree, double totalError, int runningCount) {
        this.uid = uid;
        this.sourceId = sourceId;
        this.binId = binId;
        this.band = band;
        this.status = status;
        this.errorCount = errorCount;
        this.degree = degree;
        this.totalError = totalError;
        this.runningCount = runningCount;
    }

    public long getUid() {
        return uid;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getBinId() {
        return binId;
    }

    public String getBand() {
        return band;
    }

    public BandStatus getStatus() {
        return status;
    }

    public int getErrorCount() {
        return errorCount;
    }

    /**
     * Oracle angle from the latest successful commit, or null if none yet.
     */
    public Double getDegree() {
        return degree;
    }

    public double getTotalError() {
        return totalError;
    }

    public int getRunningCount() {
        return runningCount;
    }

    @Override
    public String toString() {
        return "BandRecord{uid=" + uid + ", source='" + sourceId + "', band='" + band + "', status=" + status
                + ", errors=" + errorCount + ", running=" + totalError + "/" + runningCount + "}";
    }
}
