package com.radoncal.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BacklogStoreFactory {

    private static final Logger logger = LoggerFactory.getLogger(BacklogStoreFactory.class);

    public static final int DEFAULT_BUSY_TIMEOUT_MILLIS = 30_000;

    /**
     * Builds the store backend named by {@code type}: "sqlite" (default) or
     * "postgres".
     */
    public static JdbcBacklogStore create(String type, String sqlitePath, String jdbcUrl, String user,
            String password, int maxRunningCount) {
        String backend = (type == null || type.trim().isEmpty()) ? "sqlite" : type.trim().toLowerCase();

        switch (backend) {
            case "sqlite":
                return new SqliteBacklogStore(sqlitePath, maxRunningCount, DEFAULT_BUSY_TIMEOUT_MILLIS);
            case "postgres":
            case "postgresql":
                return new PostgresBacklogStore(jdbcUrl, user, password, maxRunningCount);
            default:
                logger.warn("Unknown store type '{}', defaulting to 'sqlite'", type);
                return new SqliteBacklogStore(sqlitePath, maxRunningCount, DEFAULT_BUSY_TIMEOUT_MILLIS);
        }
    }
}
