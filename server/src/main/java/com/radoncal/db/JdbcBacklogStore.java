package com.radoncal.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared JDBC plumbing for the backlog tables:
 * {@code bands(uid, source_id, bin_id, band, status, error_count, created_ts)}
 * and {@code rotations(band_uid, degree, total_error, running_count)}.
 */
public abstract class JdbcBacklogStore implements BacklogStore {

    private static final String FIND_RECORD_SQL = "SELECT b.uid, b.source_id, b.bin_id, b.band, b.status, " +
            "b.error_count, r.degree, r.total_error, r.running_count " +
            "FROM bands b JOIN rotations r ON b.uid = r.band_uid " +
            "WHERE b.uid = ?";

    protected final int maxRunningCount;

    protected JdbcBacklogStore(int maxRunningCount) {
        if (maxRunningCount <= 0) {
            throw new IllegalArgumentException("maxRunningCount must be positive, got " + maxRunningCount);
        }
        this.maxRunningCount = maxRunningCount;
    }

    /**
     * Creates the backlog tables if they do not exist yet.
     */
    public abstract void initialize() throws SQLException;

    protected abstract Connection connect() throws SQLException;

    /**
     * Select of pending units with one {@code LIMIT} parameter, including
     * whatever locking clause the backend needs.
     */
    protected abstract String claimSql();

    /**
     * Opens a connection with a transaction already started and strong
     * enough to keep claimed rows away from other claimants.
     */
    protected Connection beginClaimTransaction() throws SQLException {
        Connection conn = connect();
        try {
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            releaseAfterFailure(conn, e);
            throw e;
        }
        return conn;
    }

    @Override
    public ClaimedBatch claim(int limit) throws SQLException {
        if (limit <= 0) {
            throw new IllegalArgumentException("Claim limit must be positive, got " + limit);
        }
        Connection conn = beginClaimTransaction();
        try {
            List<WorkUnit> units = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(claimSql())) {
                ps.setInt(1, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        units.add(new WorkUnit(
                                rs.getLong("uid"),
                                rs.getString("source_id"),
                                rs.getString("bin_id"),
                                rs.getString("band")));
                    }
                }
            }
            return new JdbcClaimedBatch(conn, units, maxRunningCount);
        } catch (SQLException e) {
            releaseAfterFailure(conn, e);
            throw e;
        }
    }

    /**
     * Registers a band as pending work with an empty rotation record. Returns
     * the existing uid when the (source, band) pair is already known.
     */
    public long registerBand(String sourceId, String binId, String band) throws SQLException {
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                Optional<Long> existing = findUid(conn, sourceId, band);
                if (existing.isPresent()) {
                    conn.rollback();
                    return existing.get();
                }

                long uid;
                try (PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO bands (source_id, bin_id, band, status, error_count, created_ts) " +
                                "VALUES (?, ?, ?, 'pending', 0, ?)",
                        Statement.RETURN_GENERATED_KEYS)) {
                    ps.setString(1, sourceId);
                    ps.setString(2, binId);
                    ps.setString(3, band);
                    ps.setLong(4, System.currentTimeMillis());
                    ps.executeUpdate();
                    try (ResultSet rs = ps.getGeneratedKeys()) {
                        if (!rs.next()) {
                            throw new SQLException("Creating band failed, no uid obtained.");
                        }
                        uid = rs.getLong(1);
                    }
                }

                try (PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO rotations (band_uid, total_error, running_count) VALUES (?, 0, 0)")) {
                    ps.setLong(1, uid);
                    ps.executeUpdate();
                }
                conn.commit();
                return uid;
            } catch (SQLException e) {
                releaseAfterFailure(conn, e);
                throw e;
            }
        }
    }

    public Optional<BandRecord> findRecord(long uid) throws SQLException {
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(FIND_RECORD_SQL)) {
            ps.setLong(1, uid);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    double degree = rs.getDouble("degree");
                    Double storedDegree = rs.wasNull() ? null : degree;
                    return Optional.of(new BandRecord(
                            rs.getLong("uid"),
                            rs.getString("source_id"),
                            rs.getString("bin_id"),
                            rs.getString("band"),
                            BandStatus.fromColumn(rs.getString("status")),
                            rs.getInt("error_count"),
                            storedDegree,
                            rs.getDouble("total_error"),
                            rs.getInt("running_count")));
                }
            }
        }
        return Optional.empty();
    }

    public int countByStatus(BandStatus status) throws SQLException {
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM bands WHERE status = ?")) {
            ps.setString(1, status.getColumn());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    public int getMaxRunningCount() {
        return maxRunningCount;
    }

    private Optional<Long> findUid(Connection conn, String sourceId, String band) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT uid FROM bands WHERE source_id = ? AND band = ?")) {
            ps.setString(1, sourceId);
            ps.setString(2, band);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getLong(1));
                }
            }
        }
        return Optional.empty();
    }

    private static void releaseAfterFailure(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
        try {
            conn.close();
        } catch (SQLException closeError) {
            cause.addSuppressed(closeError);
        }
    }
}
