package com.radoncal.db;

/**
 * One claimable band: the smallest unit the pipeline processes and commits.
 */
public class WorkUnit {
    private final long uid;
    private final String sourceId;
    private final String binId;
    private final String band;

    public WorkUnit(long uid, String sourceId, String binId, String band) {
        this.uid = uid;
        this.sourceId = sourceId;
        this.binId = binId;
        this.band = band;
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

    @Override
    public String toString() {
        return "WorkUnit{uid=" + uid + ", source='" + sourceId + "', bin='" + binId + "', band='" + band + "'}";
    }
}
