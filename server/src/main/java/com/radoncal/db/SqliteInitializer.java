package com.radoncal.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                // WAL lets readers proceed while a claimant holds the write lock
                stmt.execute("PRAGMA journal_mode = WAL;");

                stmt.execute("CREATE TABLE IF NOT EXISTS bands (" +
                        "uid INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "source_id TEXT NOT NULL, " +
                        "bin_id TEXT NOT NULL, " +
                        "band TEXT NOT NULL, " +
                        "status TEXT NOT NULL DEFAULT 'pending', " +
                        "error_count INTEGER NOT NULL DEFAULT 0, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (source_id, band), " +
                        "CHECK (status IN ('pending', 'succeeded', 'failed'))" +
                        ");");

                stmt.execute("CREATE TABLE IF NOT EXISTS rotations (" +
                        "band_uid INTEGER PRIMARY KEY, " +
                        "degree REAL, " +
                        "total_error REAL NOT NULL DEFAULT 0, " +
                        "running_count INTEGER NOT NULL DEFAULT 0, " +
                        "FOREIGN KEY (band_uid) REFERENCES bands(uid) ON DELETE CASCADE" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_bands_pending " +
                        "ON bands (status, uid);");
            }
        }
    }
}
