package com.radoncal.server.pipeline;

/**
 * Outcome of one item in a parallel run: a value, or the failure that
 * replaced it.
 */
public class UnitResult<R> {
    private final R value;
    private final Throwable failure;

    private UnitResult(R value, Throwable failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <R> UnitResult<R> success(R value) {
        return new UnitResult<>(value, null);
    }

    public static <R> UnitResult<R> failed(Throwable failure) {
        return new UnitResult<>(null, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }

    /**
     * The computed value; null for failed items.
     */
    public R getValue() {
        return value;
    }

    public Throwable getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return isFailed() ? "UnitResult{failed=" + failure + "}" : "UnitResult{value=" + value + "}";
    }
}
