package com.radoncal.server.service;

import com.radoncal.server.config.PipelineConfig;
import com.radoncal.server.pipeline.ShutdownCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Tells the supervisor that a pipeline host is gone by deleting its status
 * entry.
 */
public class SupervisorShutdownNotifier implements ShutdownCallback {

    private static final Logger logger = LoggerFactory.getLogger(SupervisorShutdownNotifier.class);

    private final RestClient restClient;

    public SupervisorShutdownNotifier(RestClient.Builder restClientBuilder, PipelineConfig config) {
        this.restClient = restClientBuilder.baseUrl(config.supervisorBaseUrl).build();
    }

    @Override
    @Retryable(retryFor = RestClientException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 500, maxDelay = 2000))
    public void onShutdown(String hostId) {
        restClient.delete()
                .uri("/pipelines/status/{hostId}", hostId)
                .retrieve()
                .toBodilessEntity();
        logger.info("Notified supervisor that pipeline {} has stopped", hostId);
    }

    @Recover
    public void recoverOnShutdown(RestClientException e, String hostId) {
        logger.warn("Failed to notify supervisor about pipeline {} after retries: {}", hostId, e.getMessage());
    }
}
