package com.radoncal.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Loads {@link PipelineConfig} from the classpath, then applies
 * {@code radon.*} system property overrides and validates the result.
 */
public class PipelineConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfigLoader.class);

    public static final String CONFIG_RESOURCE = "/pipeline_config.json";

    public static PipelineConfig load() {
        PipelineConfig config;
        try (InputStream is = PipelineConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                logger.warn("{} not found on classpath, using defaults", CONFIG_RESOURCE);
                config = new PipelineConfig();
            } else {
                config = read(is);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + CONFIG_RESOURCE, e);
        }

        applyOverrides(config, System.getProperties());
        validate(config);
        logger.info("Loaded pipeline config: host={}, mode={}, store={}, augmentations={}, threads={}, batch={}",
                config.hostId, config.mode, config.store.type, config.augmentationCount, config.threadCount,
                config.batchSize);
        return config;
    }

    public static PipelineConfig read(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        PipelineConfig config = mapper.readValue(is, PipelineConfig.class);
        if (config.store == null) {
            config.store = new PipelineConfig.StoreConfig();
        }
        return config;
    }

    public static void applyOverrides(PipelineConfig config, Properties props) {
        String value;
        if ((value = stringProp(props, "radon.host.id")) != null) config.hostId = value;
        if ((value = stringProp(props, "radon.mode")) != null) config.mode = value;
        if ((value = stringProp(props, "radon.data.dir")) != null) config.dataDirectory = value;
        if ((value = stringProp(props, "radon.augmentation.count")) != null) config.augmentationCount = parseInt("radon.augmentation.count", value);
        if ((value = stringProp(props, "radon.thread.count")) != null) config.threadCount = parseInt("radon.thread.count", value);
        if ((value = stringProp(props, "radon.batch.size")) != null) config.batchSize = parseInt("radon.batch.size", value);
        if ((value = stringProp(props, "radon.max.running.count")) != null) config.maxRunningCount = parseInt("radon.max.running.count", value);
        if ((value = stringProp(props, "radon.store.type")) != null) config.store.type = value;
        if ((value = stringProp(props, "radon.store.sqlite.path")) != null) config.store.sqlitePath = value;
        if ((value = stringProp(props, "radon.store.jdbc.url")) != null) config.store.jdbcUrl = value;
        if ((value = stringProp(props, "radon.supervisor.base.url")) != null) config.supervisorBaseUrl = value;
    }

    public static void validate(PipelineConfig config) {
        requirePositive("augmentationCount", config.augmentationCount);
        requirePositive("threadCount", config.threadCount);
        requirePositive("batchSize", config.batchSize);
        requirePositive("maxRunningCount", config.maxRunningCount);
        if (config.maxRunningCount % config.augmentationCount != 0) {
            throw new IllegalArgumentException("maxRunningCount (" + config.maxRunningCount
                    + ") must be a multiple of augmentationCount (" + config.augmentationCount + ")");
        }
        if (config.radonFineness == null || config.radonFineness < 2) {
            throw new IllegalArgumentException("radonFineness must be at least 2, got " + config.radonFineness);
        }
        if (config.resampleBrightness == null || !(config.resampleBrightness > 0)
                || config.resampleBrightness.isInfinite()) {
            throw new IllegalArgumentException(
                    "resampleBrightness must be a positive finite number, got " + config.resampleBrightness);
        }
        requireNonNegative("unitTimeoutSeconds", config.unitTimeoutSeconds);
        requireNonNegative("batchYieldMillis", config.batchYieldMillis);
        requireNonNegative("failureBackoffMillis", config.failureBackoffMillis);
        requireNonNegative("supervisorConnectTimeoutMillis", config.supervisorConnectTimeoutMillis);
        requireNonNegative("supervisorReadTimeoutMillis", config.supervisorReadTimeoutMillis);
        requireSet("autoStart", config.autoStart);
        requireSet("exitOnCompletion", config.exitOnCompletion);

        requireNonBlank("hostId", config.hostId);
        requireNonBlank("mode", config.mode);
        requireNonBlank("dataDirectory", config.dataDirectory);
        requireNonBlank("augmenter", config.augmenter);
        requireSet("store", config.store);
        requireNonBlank("store.type", config.store.type);
    }

    private static void requirePositive(String name, Integer value) {
        if (value == null || value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    private static void requireNonNegative(String name, Number value) {
        if (value == null || value.longValue() < 0) {
            throw new IllegalArgumentException(name + " must be zero or positive, got " + value);
        }
    }

    private static void requireSet(String name, Object value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must be set");
        }
    }

    private static void requireNonBlank(String name, String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }

    private static String stringProp(Properties props, String key) {
        String value = props.getProperty(key);
        return value == null || value.isEmpty() ? null : value;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("System property " + key + " is not an integer: " + value, e);
        }
    }
}
