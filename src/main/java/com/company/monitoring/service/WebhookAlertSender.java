package com.company.monitoring.service;

import com.company.monitoring.exception.NotificationDispatchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Posts a JSON payload to one webhook. Retried and circuit broken per channel.
 */
@Component
@Slf4j
public class WebhookAlertSender {

    private final RestTemplate restTemplate;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;

    public WebhookAlertSender(@Qualifier("webhookRestTemplate") RestTemplate restTemplate,
                              Tracer tracer,
                              MeterRegistry meterRegistry) {
        this.restTemplate = restTemplate;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
    }

    @Retry(name = "webhook")
    @CircuitBreaker(name = "webhook")
    public void send(String channel, String url, Map<String, Object> payload, int alertCount) {
        Span span = tracer.spanBuilder("monitoring.alert.dispatch")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("webhook.channel", channel);
            span.setAttribute("alert.count", alertCount);

            ResponseEntity<String> response = restTemplate.postForEntity(url, payload, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new NotificationDispatchException(
                        channel + " notification failed: " + response.getStatusCode().value());
            }

            span.addEvent("Notification delivered",
                    Attributes.of(AttributeKey.longKey("http.status_code"), (long) response.getStatusCode().value()));
            meterRegistry.counter("monitoring.notifications.sent", "channel", channel).increment();
            log.info("Sent {} alerts to {}", alertCount, channel);

        } catch (RestClientException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Webhook call failed");
            meterRegistry.counter("monitoring.notifications.failed", "channel", channel).increment();
            throw new NotificationDispatchException(channel + " notification failed: " + e.getMessage(), e);
        } catch (NotificationDispatchException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            meterRegistry.counter("monitoring.notifications.failed", "channel", channel).increment();
            throw e;
        } finally {
            span.end();
        }
    }
}
