package com.radoncal.server.error;

public class NoErrorDataException extends RuntimeException {
    public NoErrorDataException(String message) {
        super(message);
    }
}
