package com.company.monitoring.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Process-wide monitoring configuration. Instances are never mutated; a reload builds a new
 * one and swaps it in.
 */
@Value
@Builder(toBuilder = true)
public class MonitoringConfig {

    public static final long MIN_POLLING_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_POLLING_INTERVAL_MS = 60_000L;

    long pollingIntervalMs;
    @Singular
    Map<String, CategorySettings> patternCategories;
    @Singular
    Map<String, HeaderOverride> headerOverrides;
    WebhookPolicy webhookPolicy;
    Instant lastUpdated;

    @Value
    @Builder
    public static class CategorySettings {
        @Builder.Default
        List<String> patterns = List.of();
        @Builder.Default
        List<String> negativePatterns = List.of();
        Double threshold;
        Long alertDurationMs;
        Long frozenThresholdMs;
        Long notificationIntervalMs;
    }

    /**
     * Per-header values that take precedence over the stored item settings and category defaults.
     * Null fields fall through.
     */
    @Value
    @Builder
    public static class HeaderOverride {
        Double threshold;
        Long alertDurationMs;
        Long frozenThresholdMs;
    }

    @Value
    @Builder(toBuilder = true)
    public static class WebhookPolicy {
        boolean enabled;
        @Builder.Default
        boolean slackEnabled = true;
        boolean teamsEnabled;
        String slackWebhookUrl;
        String teamsWebhookUrl;
        @Builder.Default
        List<String> customWebhooks = List.of();
        @Builder.Default
        boolean sendThresholdAlerts = true;
        @Builder.Default
        boolean sendFrozenAlerts = true;
        @Builder.Default
        boolean sendErrorAlerts = true;

        public static WebhookPolicy disabled() {
            return WebhookPolicy.builder().enabled(false).build();
        }
    }

    public static MonitoringConfig defaults() {
        return MonitoringConfig.builder()
                .pollingIntervalMs(DEFAULT_POLLING_INTERVAL_MS)
                .patternCategory("pressure", CategorySettings.builder()
                        .patterns(List.of("pressure", "casing", "tubing", "cbt"))
                        .negativePatterns(List.of(
                                "fdi", "derivative", "projected", "curve", "predicted", "qc",
                                "pumpdown", "treating", "inverse", "hydrostatic", "measuredpressure",
                                "natural", "gas", "seal", "p-seal"))
                        .threshold(20.0)
                        .alertDurationMs(20_000L)
                        .frozenThresholdMs(120_000L)
                        .build())
                .patternCategory("battery", CategorySettings.builder()
                        .patterns(List.of("bat", "battery"))
                        .threshold(20.0)
                        .alertDurationMs(120_000L)
                        .frozenThresholdMs(300_000L)
                        .build())
                .webhookPolicy(WebhookPolicy.disabled())
                .build();
    }
}
