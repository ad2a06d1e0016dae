package com.radoncal.server.pipeline;

import com.radoncal.db.BacklogStore;
import com.radoncal.db.ClaimedBatch;
import com.radoncal.db.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Claims a batch of units, fans it out over the worker pool and writes every
 * outcome back inside the claiming transaction, so a crash mid-batch leaves
 * the whole batch pending again.
 */
public class WorkUnitCoordinator implements BatchScript {

    private static final Logger logger = LoggerFactory.getLogger(WorkUnitCoordinator.class);

    private final BacklogStore store;
    private final UnitFunction<WorkUnit, CalibrationResult> processor;
    private final int batchSize;
    private final int threadCount;

    private final AtomicInteger iterationProgress = new AtomicInteger();
    private final AtomicInteger iterationMaxProgress = new AtomicInteger();
    private final AtomicLong totalSuccessful = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();

    public WorkUnitCoordinator(BacklogStore store, UnitFunction<WorkUnit, CalibrationResult> processor,
            int batchSize, int threadCount) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }
        if (threadCount <= 0) {
            throw new IllegalArgumentException("Thread count must be positive, got " + threadCount);
        }
        this.store = store;
        this.processor = processor;
        this.batchSize = batchSize;
        this.threadCount = threadCount;
    }

    @Override
    public BatchResult runBatch(int iteration) {
        logger.info("Starting iteration #{}...", iteration);
        iterationProgress.set(0);
        iterationMaxProgress.set(0);

        try (ClaimedBatch batch = store.claim(batchSize)) {
            List<WorkUnit> units = batch.getUnits();
            if (units.isEmpty()) {
                logger.info("No more bands to process");
                return BatchResult.noMoreWork();
            }
            iterationMaxProgress.set(units.size());

            List<UnitResult<CalibrationResult>> results = ParallelRunner.runInParallel(
                    processor, units, threadCount, iterationProgress::incrementAndGet);

            int successful = 0;
            int failed = 0;
            for (int i = 0; i < units.size(); i++) {
                WorkUnit unit = units.get(i);
                UnitResult<CalibrationResult> result = results.get(i);
                if (result.isFailed()) {
                    batch.recordFailure(unit);
                    failed++;
                } else {
                    CalibrationResult calibration = result.getValue();
                    batch.recordSuccess(unit, calibration.getOracleAngle(),
                            calibration.getError().getTotalError(), calibration.getError().getRunningCount());
                    successful++;
                }
            }
            batch.commit();

            totalSuccessful.addAndGet(successful);
            totalFailed.addAndGet(failed);
            logger.info("Iteration #{}: {} bands succeeded, {} failed", iteration, successful, failed);
            return BatchResult.processed(successful, failed);
        } catch (SQLException e) {
            logger.error("Iteration #{} rolled back after store failure", iteration, e);
            return BatchResult.storeFailure(e);
        }
    }

    @Override
    public int getIterationProgress() {
        return iterationProgress.get();
    }

    @Override
    public int getIterationMaxProgress() {
        return iterationMaxProgress.get();
    }

    @Override
    public long getTotalSuccessful() {
        return totalSuccessful.get();
    }

    @Override
    public long getTotalFailed() {
        return totalFailed.get();
    }
}
