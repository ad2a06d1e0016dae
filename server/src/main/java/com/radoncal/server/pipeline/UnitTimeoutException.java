package com.radoncal.server.pipeline;

public class UnitTimeoutException extends RuntimeException {
    public UnitTimeoutException(String message) {
        super(message);
    }
}
