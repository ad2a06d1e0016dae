package com.radoncal.server.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of a host's progress, served by the control surface.
 */
public class HostStatus {
    private final String hostId;
    private final int iteration;
    private final int iterationProgress;
    private final int iterationMaxProgress;
    private final HostState state;
    private final long successful;
    private final long failed;

    public HostStatus(String hostId, int iteration, int iterationProgress, int iterationMaxProgress,
            HostState state, long successful, long failed) {
        this.hostId = hostId;
        this.iteration = iteration;
        this.iterationProgress = iterationProgress;
        this.iterationMaxProgress = iterationMaxProgress;
        this.state = state;
        this.successful = successful;
        this.failed = failed;
    }

    @JsonProperty("host_id")
    public String getHostId() {
        return hostId;
    }

    @JsonProperty("iteration")
    public int getIteration() {
        return iteration;
    }

    @JsonProperty("iteration_progress")
    public int getIterationProgress() {
        return iterationProgress;
    }

    @JsonProperty("iteration_max_progress")
    public int getIterationMaxProgress() {
        return iterationMaxProgress;
    }

    @JsonProperty("state")
    public HostState getState() {
        return state;
    }

    @JsonProperty("successful")
    public long getSuccessful() {
        return successful;
    }

    @JsonProperty("failed")
    public long getFailed() {
        return failed;
    }
}
