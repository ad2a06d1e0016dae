package com.radoncal.server.pipeline;

public class BatchResult {
    private final BatchOutcome outcome;
    private final int successful;
    private final int failed;
    private final Throwable failure;

    private BatchResult(BatchOutcome outcome, int successful, int failed, Throwable failure) {
        this.outcome = outcome;
        this.successful = successful;
        this.failed = failed;
        this.failure = failure;
    }

    public static BatchResult processed(int successful, int failed) {
        return new BatchResult(BatchOutcome.PROCESSED, successful, failed, null);
    }

    public static BatchResult noMoreWork() {
        return new BatchResult(BatchOutcome.NO_MORE_WORK, 0, 0, null);
    }

    public static BatchResult storeFailure(Throwable failure) {
        return new BatchResult(BatchOutcome.STORE_FAILURE, 0, 0, failure);
    }

    public BatchOutcome getOutcome() {
        return outcome;
    }

    public int getSuccessful() {
        return successful;
    }

    public int getFailed() {
        return failed;
    }

    public Throwable getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return "BatchResult{" + outcome + ", successful=" + successful + ", failed=" + failed + "}";
    }
}
