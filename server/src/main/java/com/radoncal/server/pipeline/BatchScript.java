package com.radoncal.server.pipeline;

/**
 * One repeatable unit of pipeline work, driven by {@link ScriptLifecycleHost}.
 */
public interface BatchScript {

    /**
     * Claims and processes one batch. Must not throw for per-unit failures;
     * store failures are reported as {@link BatchOutcome#STORE_FAILURE}.
     */
    BatchResult runBatch(int iteration);

    int getIterationProgress();

    int getIterationMaxProgress();

    long getTotalSuccessful();

    long getTotalFailed();
}
