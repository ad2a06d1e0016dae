package com.radoncal.server.pipeline;

import java.time.Duration;

/**
 * Cooperative time limit for one unit, checked between steps of its work.
 */
public class UnitDeadline {

    private static final UnitDeadline NONE = new UnitDeadline(Long.MAX_VALUE, Duration.ZERO);

    private final long deadlineNanos;
    private final Duration budget;

    private UnitDeadline(long deadlineNanos, Duration budget) {
        this.deadlineNanos = deadlineNanos;
        this.budget = budget;
    }

    /**
     * A deadline {@code budget} from now; zero or negative means unlimited.
     */
    public static UnitDeadline after(Duration budget) {
        if (budget == null || budget.isZero() || budget.isNegative()) {
            return NONE;
        }
        return new UnitDeadline(System.nanoTime() + budget.toNanos(), budget);
    }

    public boolean isExpired() {
        return this != NONE && System.nanoTime() - deadlineNanos > 0;
    }

    public void check(String context) {
        if (isExpired()) {
            throw new UnitTimeoutException("Exceeded unit time limit of " + budget.toMillis() + " ms " + context);
        }
    }
}
