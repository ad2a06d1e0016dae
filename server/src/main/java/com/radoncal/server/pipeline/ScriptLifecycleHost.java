package com.radoncal.server.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a {@link BatchScript} repeatedly on a background thread until the
 * backlog is drained or a stop is requested. The stop flag is only read
 * between batches, so a batch in flight always finishes and commits.
 */
public class ScriptLifecycleHost implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScriptLifecycleHost.class);
    private static final long CLOSE_TIMEOUT_SECONDS = 60;

    private final String hostId;
    private final BatchScript script;
    private final ShutdownCallback exitCallback;
    private final long batchYieldMillis;
    private final long failureBackoffMillis;

    private final ExecutorService loopExecutor;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean exitFired = new AtomicBoolean(false);
    private final AtomicReference<HostState> state = new AtomicReference<>(HostState.NOT_STARTED);
    private final AtomicInteger iteration = new AtomicInteger();
    private volatile Future<?> loopFuture;

    public ScriptLifecycleHost(String hostId, BatchScript script, ShutdownCallback exitCallback,
            long batchYieldMillis, long failureBackoffMillis) {
        this.hostId = hostId;
        this.script = script;
        this.exitCallback = exitCallback;
        this.batchYieldMillis = Math.max(0, batchYieldMillis);
        this.failureBackoffMillis = Math.max(0, failureBackoffMillis);
        this.loopExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "pipeline-host-" + hostId);
            t.setDaemon(false);
            return t;
        });
    }

    public void start() {
        if (!state.compareAndSet(HostState.NOT_STARTED, HostState.RUNNING)) {
            throw new IllegalStateException("Host " + hostId + " has already been started");
        }
        logger.info("Starting pipeline host {}", hostId);
        loopFuture = loopExecutor.submit(this::runLoop);
    }

    /**
     * Asks the loop to stop after the current batch.
     *
     * @return true if the host was running when the request arrived
     */
    public boolean requestStop() {
        stopRequested.set(true);
        boolean wasRunning = state.compareAndSet(HostState.RUNNING, HostState.STOPPING);
        logger.info("Stop requested for host {} (state now {})", hostId, state.get());
        return wasRunning;
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public HostState getState() {
        return state.get();
    }

    public HostStatus getStatus() {
        return new HostStatus(hostId, iteration.get(), script.getIterationProgress(),
                script.getIterationMaxProgress(), state.get(), script.getTotalSuccessful(), script.getTotalFailed());
    }

    /**
     * Waits for the loop to finish, including the exit callback.
     *
     * @return true if the loop finished within the timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        Future<?> future = loopFuture;
        if (future == null) {
            return state.get() == HostState.STOPPED;
        }
        try {
            future.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            logger.error("Pipeline host {} loop ended abnormally", hostId, e.getCause());
            return true;
        }
    }

    private void runLoop() {
        try {
            while (!stopRequested.get()) {
                int current = iteration.incrementAndGet();
                BatchResult result;
                try {
                    result = script.runBatch(current);
                } catch (RuntimeException e) {
                    logger.error("Iteration #{} failed unexpectedly", current, e);
                    result = BatchResult.storeFailure(e);
                }

                if (result.getOutcome() == BatchOutcome.NO_MORE_WORK) {
                    logger.info("Backlog drained after {} iterations, stopping host {}", current, hostId);
                    stopRequested.set(true);
                    state.compareAndSet(HostState.RUNNING, HostState.STOPPING);
                    break;
                }

                long pause = result.getOutcome() == BatchOutcome.STORE_FAILURE ? failureBackoffMillis : batchYieldMillis;
                if (!pause(pause)) {
                    break;
                }
            }
        } finally {
            state.set(HostState.STOPPED);
            fireExit();
        }
    }

    private boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Pipeline host {} interrupted, stopping", hostId);
            return false;
        }
    }

    private void fireExit() {
        if (!exitFired.compareAndSet(false, true)) {
            return;
        }
        logger.info("Pipeline host {} stopped", hostId);
        try {
            exitCallback.onShutdown(hostId);
        } catch (RuntimeException e) {
            logger.error("Exit callback failed for host {}", hostId, e);
        }
    }

    @Override
    public void close() {
        requestStop();
        if (state.compareAndSet(HostState.NOT_STARTED, HostState.STOPPED)) {
            loopExecutor.shutdown();
            return;
        }
        loopExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Pipeline host {} did not stop within {}s, interrupting", hostId, CLOSE_TIMEOUT_SECONDS);
                loopExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            loopExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
