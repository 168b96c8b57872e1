package com.company.monitoring.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class RestTemplateConfig {

    private final MeterRegistry meterRegistry;

    @Value("${monitoring.telemetry.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${monitoring.telemetry.fetch-timeout-ms:10000}")
    private int readTimeoutMs;

    @Value("${monitoring.telemetry.token:}")
    private String token;

    @Value("${monitoring.notifications.connect-timeout-ms:5000}")
    private int webhookConnectTimeoutMs;

    @Value("${monitoring.notifications.read-timeout-ms:10000}")
    private int webhookReadTimeoutMs;

    /**
     * Telemetry API client with bearer authentication
     */
    @Bean(name = "telemetryRestTemplate")
    public RestTemplate telemetryRestTemplate(RestTemplateBuilder builder) {
        if (token == null || token.isBlank()) {
            log.warn("No telemetry API token configured, requests will be unauthenticated");
        }

        RestTemplate restTemplate = builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .additionalInterceptors(authInterceptor())
                .additionalInterceptors(metricsInterceptor())
                .build();

        log.info("Telemetry RestTemplate configured with connect timeout: {}ms, read timeout: {}ms",
                connectTimeoutMs, readTimeoutMs);
        return restTemplate;
    }

    @Bean(name = "webhookRestTemplate")
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(webhookConnectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(webhookReadTimeoutMs))
                .build();
    }

    private ClientHttpRequestInterceptor authInterceptor() {
        return (request, body, execution) -> {
            HttpHeaders headers = request.getHeaders();
            if (token != null && !token.isBlank()) {
                headers.setBearerAuth(token);
            }
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            return execution.execute(request, body);
        };
    }

    private ClientHttpRequestInterceptor metricsInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            try {
                ClientHttpResponse response = execution.execute(request, body);
                meterRegistry.timer("telemetry.api.request.duration",
                        "status", String.valueOf(response.getStatusCode().value())
                ).record(Duration.ofMillis(System.currentTimeMillis() - startTime));
                return response;
            } catch (IOException e) {
                meterRegistry.counter("telemetry.api.request.errors",
                        "exception", e.getClass().getSimpleName()
                ).increment();
                throw e;
            }
        };
    }
}
