package com.radoncal.server.config;

import java.io.File;

/**
 * Settings for one pipeline host, mapped from {@code /pipeline_config.json}.
 */
public class PipelineConfig {
    public String hostId = "local";
    public String mode = "development";
    public String dataDirectory = ".";

    public Integer augmentationCount = 100;
    public Integer threadCount = 16;
    public Integer batchSize = 64;
    public Integer maxRunningCount = 100;
    public Integer radonFineness = 181;
    public Double resampleBrightness = 30.0;
    public String augmenter = "random";
    public Long randomSeed;

    public Integer unitTimeoutSeconds = 120;
    public Long batchYieldMillis = 100L;
    public Long failureBackoffMillis = 2000L;

    public Boolean autoStart = true;
    public Boolean exitOnCompletion = true;
    public String supervisorBaseUrl;
    public Long supervisorConnectTimeoutMillis = 5000L;
    public Long supervisorReadTimeoutMillis = 10000L;

    public StoreConfig store = new StoreConfig();

    public static class StoreConfig {
        public String type = "sqlite";
        public String sqlitePath;
        public String jdbcUrl;
        public String user;
        public String password;
    }

    /**
     * SQLite file to use; defaults to a file inside the data directory.
     */
    public String resolveSqlitePath() {
        if (store != null && store.sqlitePath != null && !store.sqlitePath.isEmpty()) {
            return store.sqlitePath;
        }
        return dataDirectory + File.separator + "radon_backlog.db";
    }

    public boolean isProduction() {
        return "production".equalsIgnoreCase(mode);
    }

    public boolean hasSupervisor() {
        return supervisorBaseUrl != null && !supervisorBaseUrl.trim().isEmpty();
    }
}
