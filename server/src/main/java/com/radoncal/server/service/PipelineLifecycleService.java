package com.radoncal.server.service;

import com.radoncal.server.config.PipelineConfig;
import com.radoncal.server.pipeline.HostStatus;
import com.radoncal.server.pipeline.ScriptLifecycleHost;
import com.radoncal.server.pipeline.ShutdownCallback;
import com.radoncal.server.pipeline.WorkUnitCoordinator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Service;

/**
 * Owns the pipeline host for the lifetime of the application context.
 */
@Service
public class PipelineLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(PipelineLifecycleService.class);

    private final PipelineConfig config;
    private final ShutdownCallback shutdownCallback;
    private final ConfigurableApplicationContext context;
    private final ScriptLifecycleHost host;

    public PipelineLifecycleService(PipelineConfig config, WorkUnitCoordinator coordinator,
            ShutdownCallback shutdownCallback, ConfigurableApplicationContext context) {
        this.config = config;
        this.shutdownCallback = shutdownCallback;
        this.context = context;
        this.host = new ScriptLifecycleHost(config.hostId, coordinator, this::onHostExit,
                config.batchYieldMillis, config.failureBackoffMillis);
    }

    @PostConstruct
    public void init() {
        if (Boolean.TRUE.equals(config.autoStart)) {
            host.start();
        } else {
            logger.info("autoStart disabled, pipeline host {} is idle", config.hostId);
        }
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Closing pipeline host {}", config.hostId);
        host.close();
    }

    public boolean requestStop() {
        return host.requestStop();
    }

    public HostStatus getStatus() {
        return host.getStatus();
    }

    private void onHostExit(String hostId) {
        shutdownCallback.onShutdown(hostId);
        if (Boolean.TRUE.equals(config.exitOnCompletion)) {
            // closing the context joins the host loop, so it cannot run on the loop thread
            Thread exitThread = new Thread(() -> {
                int code = SpringApplication.exit(context);
                logger.info("Application context closed with exit code {}", code);
            }, "pipeline-exit");
            exitThread.start();
        }
    }
}
