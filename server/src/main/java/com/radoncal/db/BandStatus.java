package com.radoncal.db;

public enum BandStatus {
    PENDING("pending"),
    SUCCEEDED("succeeded"),
    FAILED("failed");

    private final String column;

    BandStatus(String column) {
        this.column = column;
    }

    public String getColumn() {
        return column;
    }

    public static BandStatus fromColumn(String value) {
        for (BandStatus status : values()) {
            if (status.column.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown band status '" + value + "'");
    }
}
