package com.radoncal.server.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

/**
 * Timeouts for the HTTP client that reports to the supervisor. The
 * shutdown notice is sent while the host is exiting, so both limits come
 * from {@link PipelineConfig} rather than library defaults.
 */
@Configuration
public class SupervisorClientConfig {

    @Bean
    RestClientCustomizer supervisorTimeoutCustomizer(PipelineConfig config) {
        Duration connectTimeout = Duration.ofMillis(config.supervisorConnectTimeoutMillis);
        Duration readTimeout = Duration.ofMillis(config.supervisorReadTimeoutMillis);
        return builder -> {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(connectTimeout);
            requestFactory.setReadTimeout(readTimeout);
            builder.requestFactory(requestFactory);
        };
    }
}
