package com.radoncal.server.pipeline;

public enum BatchOutcome {
    PROCESSED,
    NO_MORE_WORK,
    STORE_FAILURE
}
