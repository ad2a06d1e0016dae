package com.radoncal.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;

class JdbcClaimedBatch implements ClaimedBatch {

    private static final Logger logger = LoggerFactory.getLogger(JdbcClaimedBatch.class);

    private static final String ADD_ERROR_SQL = "UPDATE rotations " +
            "SET total_error = total_error + ?, running_count = running_count + ?, degree = ? " +
            "WHERE band_uid = ?";

    private static final String SETTLE_STATUS_SQL = "UPDATE bands SET status = CASE " +
            "WHEN (SELECT running_count FROM rotations WHERE band_uid = ?) >= ? THEN 'succeeded' " +
            "ELSE 'pending' END " +
            "WHERE uid = ?";

    private static final String ADD_FAILURE_SQL = "UPDATE bands " +
            "SET error_count = error_count + 1, status = 'failed' " +
            "WHERE uid = ?";

    private final Connection conn;
    private final List<WorkUnit> units;
    private final int maxRunningCount;
    private boolean committed = false;

    JdbcClaimedBatch(Connection conn, List<WorkUnit> units, int maxRunningCount) {
        this.conn = conn;
        this.units = Collections.unmodifiableList(units);
        this.maxRunningCount = maxRunningCount;
    }

    @Override
    public List<WorkUnit> getUnits() {
        return units;
    }

    @Override
    public void recordSuccess(WorkUnit unit, int oracleDegree, double totalError, int runningCount)
            throws SQLException {
        // increments only, never overwrite: other processes may commit to the same totals
        try (PreparedStatement ps = conn.prepareStatement(ADD_ERROR_SQL)) {
            ps.setDouble(1, totalError);
            ps.setInt(2, runningCount);
            ps.setDouble(3, oracleDegree);
            ps.setLong(4, unit.getUid());
            ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement(SETTLE_STATUS_SQL)) {
            ps.setLong(1, unit.getUid());
            ps.setInt(2, maxRunningCount);
            ps.setLong(3, unit.getUid());
            ps.executeUpdate();
        }
    }

    @Override
    public void recordFailure(WorkUnit unit) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(ADD_FAILURE_SQL)) {
            ps.setLong(1, unit.getUid());
            ps.executeUpdate();
        }
    }

    @Override
    public void commit() throws SQLException {
        conn.commit();
        committed = true;
    }

    @Override
    public void close() throws SQLException {
        try {
            if (!committed) {
                logger.info("Rolling back uncommitted batch of {} units", units.size());
                conn.rollback();
            }
        } finally {
            conn.close();
        }
    }
}
