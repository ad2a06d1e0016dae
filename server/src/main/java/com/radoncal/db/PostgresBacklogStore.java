package com.radoncal.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Shared backlog for production. Claims lock their rows with
 * {@code FOR UPDATE SKIP LOCKED}, so any number of hosts can drain the same
 * table: each sees only rows no other open transaction holds.
 */
public class PostgresBacklogStore extends JdbcBacklogStore {

    private static final String CLAIM_SQL = "SELECT uid, source_id, bin_id, band FROM bands " +
            "WHERE status = 'pending' " +
            "ORDER BY uid " +
            "LIMIT ? " +
            "FOR UPDATE SKIP LOCKED";

    private final String jdbcUrl;
    private final String user;
    private final String password;

    public PostgresBacklogStore(String jdbcUrl, String user, String password, int maxRunningCount) {
        super(maxRunningCount);
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
    }

    @Override
    public void initialize() throws SQLException {
        try (Connection conn = connect();
                Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS bands (" +
                    "uid BIGSERIAL PRIMARY KEY, " +
                    "source_id VARCHAR NOT NULL, " +
                    "bin_id VARCHAR NOT NULL, " +
                    "band VARCHAR NOT NULL, " +
                    "status VARCHAR NOT NULL DEFAULT 'pending', " +
                    "error_count INT NOT NULL DEFAULT 0, " +
                    "created_ts BIGINT NOT NULL, " +
                    "UNIQUE (source_id, band), " +
                    "CHECK (status IN ('pending', 'succeeded', 'failed'))" +
                    ")");
            stmt.execute("CREATE TABLE IF NOT EXISTS rotations (" +
                    "band_uid BIGINT PRIMARY KEY REFERENCES bands (uid) ON DELETE CASCADE, " +
                    "degree DOUBLE PRECISION, " +
                    "total_error DOUBLE PRECISION NOT NULL DEFAULT 0, " +
                    "running_count INT NOT NULL DEFAULT 0" +
                    ")");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_bands_pending ON bands (status, uid)");
        }
    }

    @Override
    protected Connection connect() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, user, password);
    }

    @Override
    protected String claimSql() {
        return CLAIM_SQL;
    }
}
