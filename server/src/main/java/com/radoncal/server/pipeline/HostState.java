package com.radoncal.server.pipeline;

public enum HostState {
    NOT_STARTED,
    RUNNING,
    STOPPING,
    STOPPED
}
