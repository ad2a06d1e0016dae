package com.radoncal.server.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Static worker pool for one batch. Worker {@code k} of {@code W} handles
 * items {@code k, k + W, k + 2W, ...}; interleaving spreads slow items across
 * workers without any work stealing. Threads are created per call and all of
 * them are joined before it returns.
 */
public class ParallelRunner {

    private static final Logger logger = LoggerFactory.getLogger(ParallelRunner.class);

    /**
     * Runs {@code function} over {@code items} on at most {@code workerCount}
     * threads. Results keep the order of {@code items}; an item that throws
     * (including an {@link Error}) yields a failed result and does not affect
     * its siblings. A {@link VirtualMachineError} other than a stack
     * overflow still ends its worker.
     *
     * @param onItemDone called on the worker thread after every item, may be null;
     *                   must be cheap and must not block
     */
    public static <T, R> List<UnitResult<R>> runInParallel(UnitFunction<T, R> function, List<T> items,
            int workerCount, Runnable onItemDone) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be positive, got " + workerCount);
        }

        int itemCount = items.size();
        @SuppressWarnings("unchecked")
        UnitResult<R>[] results = new UnitResult[itemCount];
        int workers = Math.min(workerCount, itemCount);

        Thread[] threads = new Thread[workers];
        for (int k = 0; k < workers; k++) {
            final int offset = k;
            threads[k] = new Thread(() -> runSlice(function, items, results, offset, workers, onItemDone),
                    "unit-worker-" + k);
            threads[k].setUncaughtExceptionHandler(
                    (t, e) -> logger.error("Worker {} died unexpectedly", t.getName(), e));
            threads[k].start();
        }

        boolean interrupted = false;
        for (Thread thread : threads) {
            while (true) {
                try {
                    thread.join();
                    break;
                } catch (InterruptedException e) {
                    // keep joining: no worker may outlive the batch that owns its results
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        List<UnitResult<R>> ordered = new ArrayList<>(itemCount);
        for (int i = 0; i < itemCount; i++) {
            UnitResult<R> result = results[i];
            ordered.add(result != null ? result
                    : UnitResult.failed(new IllegalStateException("Worker terminated before item " + i)));
        }
        return ordered;
    }

    private static <T, R> void runSlice(UnitFunction<T, R> function, List<T> items, UnitResult<R>[] results,
            int offset, int stride, Runnable onItemDone) {
        for (int i = offset; i < items.size(); i += stride) {
            T item = items.get(i);
            try {
                results[i] = UnitResult.success(function.apply(item));
            } catch (Throwable e) {
                results[i] = UnitResult.failed(e);
                if (isFatal(e)) {
                    throw (Error) e;
                }
                logger.error("Error processing {}: {}", item, e.getMessage(), e);
            }

            if (onItemDone != null) {
                try {
                    onItemDone.run();
                } catch (RuntimeException e) {
                    logger.warn("Progress callback failed after {}", item, e);
                }
            }
        }
    }

    /**
     * Out of memory and internal JVM errors. A stack overflow is unwound by
     * the time it reaches the worker, so it only fails its own item.
     */
    static boolean isFatal(Throwable e) {
        return e instanceof VirtualMachineError && !(e instanceof StackOverflowError);
    }
}
