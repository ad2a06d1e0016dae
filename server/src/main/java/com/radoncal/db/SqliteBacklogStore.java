package com.radoncal.db;

import org.sqlite.SQLiteConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Embedded backlog for local runs. SQLite has no row locks, so a claim takes
 * the database write lock up front ({@code BEGIN IMMEDIATE}) and holds it
 * until commit or rollback; concurrent claimants wait up to the busy timeout.
 */
public class SqliteBacklogStore extends JdbcBacklogStore {

    private static final String CLAIM_SQL = "SELECT uid, source_id, bin_id, band FROM bands " +
            "WHERE status = 'pending' " +
            "ORDER BY uid " +
            "LIMIT ?";

    private final String dbPath;
    private final int busyTimeoutMillis;

    public SqliteBacklogStore(String dbPath, int maxRunningCount, int busyTimeoutMillis) {
        super(maxRunningCount);
        this.dbPath = dbPath;
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    @Override
    public void initialize() throws SQLException {
        SqliteInitializer.initialize(dbPath);
    }

    @Override
    protected Connection connect() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(busyTimeoutMillis);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath, config.toProperties());
    }

    @Override
    protected String claimSql() {
        return CLAIM_SQL;
    }

    public String getDbPath() {
        return dbPath;
    }
}
