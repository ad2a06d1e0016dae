package com.radoncal.db;

import java.sql.SQLException;
import java.util.List;

/**
 * The open transaction behind one claim. Outcomes recorded here become
 * visible together on {@link #commit()}; closing without committing rolls
 * back and releases the units to pending.
 */
public interface ClaimedBatch extends AutoCloseable {

    List<WorkUnit> getUnits();

    /**
     * Adds the unit's error statistics to its stored totals and stores the
     * oracle angle. The unit goes back to pending until its running count
     * reaches the store's cap.
     */
    void recordSuccess(WorkUnit unit, int oracleDegree, double totalError, int runningCount) throws SQLException;

    /**
     * Increments the unit's error counter and marks it failed for good.
     */
    void recordFailure(WorkUnit unit) throws SQLException;

    void commit() throws SQLException;

    @Override
    void close() throws SQLException;
}
