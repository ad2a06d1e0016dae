package com.radoncal.server.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

public class PipelineConfigLoaderTest {

    private static PipelineConfig read(String json) throws IOException {
        return PipelineConfigLoader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testClasspathConfigLoads() {
        PipelineConfig config = PipelineConfigLoader.load();

        Assertions.assertNotNull(config.hostId);
        Assertions.assertEquals(0, config.maxRunningCount % config.augmentationCount);
        Assertions.assertNotNull(config.store);
    }

    @Test
    public void testMissingFieldsKeepDefaults() throws IOException {
        PipelineConfig config = read("{\"hostId\": \"radon-7\", \"threadCount\": 4}");

        Assertions.assertEquals("radon-7", config.hostId);
        Assertions.assertEquals(4, config.threadCount);
        Assertions.assertEquals(100, config.augmentationCount);
        Assertions.assertEquals(181, config.radonFineness);
        Assertions.assertEquals("sqlite", config.store.type);
        Assertions.assertFalse(config.isProduction());
    }

    @Test
    public void testNestedStoreSection() throws IOException {
        PipelineConfig config = read("{\"store\": {\"type\": \"postgres\", \"jdbcUrl\": \"jdbc:postgresql://db/radon\"}}");

        Assertions.assertEquals("postgres", config.store.type);
        Assertions.assertEquals("jdbc:postgresql://db/radon", config.store.jdbcUrl);
    }

    @Test
    public void testSystemPropertyOverrides() throws IOException {
        PipelineConfig config = read("{}");
        Properties props = new Properties();
        props.setProperty("radon.host.id", "container-12");
        props.setProperty("radon.mode", "production");
        props.setProperty("radon.augmentation.count", "50");
        props.setProperty("radon.max.running.count", "150");
        props.setProperty("radon.store.sqlite.path", "/tmp/b.db");
        props.setProperty("radon.supervisor.base.url", "http://backend:5000");

        PipelineConfigLoader.applyOverrides(config, props);
        PipelineConfigLoader.validate(config);

        Assertions.assertEquals("container-12", config.hostId);
        Assertions.assertTrue(config.isProduction());
        Assertions.assertEquals(50, config.augmentationCount);
        Assertions.assertEquals(150, config.maxRunningCount);
        Assertions.assertEquals("/tmp/b.db", config.resolveSqlitePath());
        Assertions.assertTrue(config.hasSupervisor());
    }

    @Test
    public void testDefaultSqlitePathIsInDataDirectory() throws IOException {
        PipelineConfig config = read("{\"dataDirectory\": \"/data\"}");
        Assertions.assertTrue(config.resolveSqlitePath().startsWith("/data"));
        Assertions.assertTrue(config.resolveSqlitePath().endsWith("radon_backlog.db"));
    }

    @Test
    public void testNonIntegerOverrideRejected() throws IOException {
        PipelineConfig config = read("{}");
        Properties props = new Properties();
        props.setProperty("radon.thread.count", "many");

        Assertions.assertThrows(IllegalArgumentException.class, () -> PipelineConfigLoader.applyOverrides(config, props));
    }

    @Test
    public void testValidation() throws IOException {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"augmentationCount\": 0}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"threadCount\": -1}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"maxRunningCount\": 150}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"radonFineness\": 1}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"hostId\": \" \"}")));

        PipelineConfigLoader.validate(read("{\"augmentationCount\": 25, \"maxRunningCount\": 75}"));
    }

    @Test
    public void testNullTimingsAreRejected() throws IOException {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"unitTimeoutSeconds\": null, \"batchYieldMillis\": null}")));
        Assertions.assertTrue(e.getMessage().startsWith("unitTimeoutSeconds"));

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"batchYieldMillis\": null}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"failureBackoffMillis\": -5}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"unitTimeoutSeconds\": -1}")));

        PipelineConfigLoader.validate(read("{\"unitTimeoutSeconds\": 0, \"batchYieldMillis\": 0}"));
    }

    @Test
    public void testResampleBrightnessMustBePositive() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"resampleBrightness\": -1.0}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"resampleBrightness\": 0.0}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"resampleBrightness\": null}")));
    }

    @Test
    public void testNullFlagsAndNamesAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"autoStart\": null}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"exitOnCompletion\": null}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"dataDirectory\": null}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"augmenter\": \"\"}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.validate(read("{\"store\": {\"type\": null}}")));
    }
}
