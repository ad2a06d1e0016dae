package com.radoncal.server.service;

import com.radoncal.server.config.PipelineConfig;
import com.radoncal.server.pipeline.LoggingShutdownCallback;
import com.radoncal.server.pipeline.ShutdownCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class ShutdownCallbackConfig {

    private static final Logger logger = LoggerFactory.getLogger(ShutdownCallbackConfig.class);

    /**
     * Production hosts report to the supervisor; anything else only logs.
     */
    @Bean
    public ShutdownCallback shutdownCallback(PipelineConfig config, RestClient.Builder restClientBuilder) {
        if (config.isProduction()) {
            if (config.hasSupervisor()) {
                return new SupervisorShutdownNotifier(restClientBuilder, config);
            }
            logger.warn("Production mode without supervisorBaseUrl, shutdown will only be logged");
        }
        return new LoggingShutdownCallback();
    }
}
