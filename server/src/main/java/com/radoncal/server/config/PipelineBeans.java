package com.radoncal.server.config;

import com.radoncal.db.BacklogStoreFactory;
import com.radoncal.db.JdbcBacklogStore;
import com.radoncal.server.imaging.AmbientDenoiser;
import com.radoncal.server.imaging.BandImagePipeline;
import com.radoncal.server.imaging.CircleMaskGenerator;
import com.radoncal.server.imaging.MaskGenerator;
import com.radoncal.server.imaging.augment.Augmenter;
import com.radoncal.server.imaging.augment.AugmenterFactory;
import com.radoncal.server.ingest.FileBandImageSource;
import com.radoncal.server.pipeline.BandCalibrationProcessor;
import com.radoncal.server.pipeline.WorkUnitCoordinator;
import com.radoncal.server.radon.RadonTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Random;

/**
 * Wires the calibration pipeline from {@link PipelineConfig}.
 */
@Configuration
public class PipelineBeans {

    private static final Logger logger = LoggerFactory.getLogger(PipelineBeans.class);

    @Bean
    public PipelineConfig pipelineConfig() {
        return PipelineConfigLoader.load();
    }

    @Bean
    public JdbcBacklogStore backlogStore(PipelineConfig config) {
        JdbcBacklogStore store = BacklogStoreFactory.create(config.store.type, config.resolveSqlitePath(),
                config.store.jdbcUrl, config.store.user, config.store.password, config.maxRunningCount);
        try {
            store.initialize();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize backlog store", e);
        }
        return store;
    }

    @Bean
    public MaskGenerator maskGenerator() {
        return new CircleMaskGenerator();
    }

    @Bean
    public BandCalibrationProcessor bandCalibrationProcessor(PipelineConfig config, MaskGenerator maskGenerator) {
        Random random = config.randomSeed != null ? new Random(config.randomSeed) : new Random();
        Augmenter augmenter = AugmenterFactory.create(config.augmenter, random, config.resampleBrightness);
        BandImagePipeline preprocessing = BandImagePipeline.standard(maskGenerator, new AmbientDenoiser());
        logger.info("Preprocessing stages: {}", preprocessing.getStageNames());

        return new BandCalibrationProcessor(
                new FileBandImageSource(config.dataDirectory),
                preprocessing,
                new RadonTransformer(maskGenerator, config.radonFineness),
                augmenter,
                config.augmentationCount,
                Duration.ofSeconds(config.unitTimeoutSeconds));
    }

    @Bean
    public WorkUnitCoordinator workUnitCoordinator(PipelineConfig config, JdbcBacklogStore backlogStore,
            BandCalibrationProcessor processor) {
        return new WorkUnitCoordinator(backlogStore, processor, config.batchSize, config.threadCount);
    }
}
