package com.radoncal.server.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingShutdownCallback implements ShutdownCallback {
    private static final Logger logger = LoggerFactory.getLogger(LoggingShutdownCallback.class);

    @Override
    public void onShutdown(String hostId) {
        logger.info("Pipeline host {} finished; no supervisor configured", hostId);
    }
}
