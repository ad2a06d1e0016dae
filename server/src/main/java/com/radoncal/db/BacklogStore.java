package com.radoncal.db;

import java.sql.SQLException;

/**
 * Shared backlog of pending work units.
 * <p>
 * Implementations must make claimed units invisible to every other claimant
 * until the returned batch is committed or closed, including claimants in
 * other processes.
 */
public interface BacklogStore {

    /**
     * Opens a transaction and claims up to {@code limit} pending units,
     * ordered by uid. An empty batch means there is no more work.
     */
    ClaimedBatch claim(int limit) throws SQLException;
}
