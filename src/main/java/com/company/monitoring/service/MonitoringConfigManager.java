package com.company.monitoring.service;

import com.company.monitoring.domain.ConfigReloadResult;
import com.company.monitoring.domain.MonitoredItem;
import com.company.monitoring.domain.MonitoringConfig;
import com.company.monitoring.domain.MonitoringConfig.CategorySettings;
import com.company.monitoring.domain.MonitoringConfig.HeaderOverride;
import com.company.monitoring.domain.MonitoringConfig.WebhookPolicy;
import com.company.monitoring.domain.ResolvedAlertSettings;
import com.company.monitoring.domain.StoredSettings;
import com.company.monitoring.event.PollingIntervalChangedEvent;
import com.company.monitoring.exception.ConfigValidationException;
import com.company.monitoring.exception.StoreException;
import com.company.monitoring.repository.MonitoringSettingsRepository;
import com.company.monitoring.util.DurationUnits;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads, validates and publishes the monitoring configuration.
 *
 * <p>A reload builds a complete new {@link MonitoringConfig} and swaps it in only when every
 * step succeeded. Malformed JSON sections fall back to the values of the config in use;
 * store failures abort the reload and leave the current config untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MonitoringConfigManager {

    private final MonitoringSettingsRepository settingsRepository;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final HealthStatusTracker healthTracker;
    private final MeterRegistry meterRegistry;

    private final AtomicReference<MonitoringConfig> current = new AtomicReference<>(MonitoringConfig.defaults());
    private final AtomicReference<MonitoringConfig> previous = new AtomicReference<>();
    private final Object reloadLock = new Object();

    @Value("${monitoring.alerts.default-alert-duration-ms:20000}")
    private long defaultAlertDurationMs = 20_000L;

    @Value("${monitoring.alerts.default-frozen-threshold-ms:120000}")
    private long defaultFrozenThresholdMs = 120_000L;

    public MonitoringConfig current() {
        return current.get();
    }

    /**
     * Config that was active before the last successful reload, null until the first swap
     */
    public MonitoringConfig previous() {
        return previous.get();
    }

    public ConfigReloadResult reload() {
        synchronized (reloadLock) {
            MonitoringConfig inUse = current.get();
            log.info("Loading monitoring configuration...");

            MonitoringConfig loaded;
            try {
                loaded = loadFromStore(inUse);
            } catch (StoreException e) {
                log.error("Failed to load configuration, keeping previous configuration", e);
                healthTracker.recordConfigLoad(false, e.getMessage());
                meterRegistry.counter("monitoring.config.reload", "result", "failure").increment();
                return ConfigReloadResult.failure(inUse, e.getMessage());
            }

            previous.set(inUse);
            current.set(loaded);
            healthTracker.recordConfigLoad(true, null);
            meterRegistry.counter("monitoring.config.reload", "result", "success").increment();

            log.info("Loaded monitoring settings: pollingInterval={}ms, patternCategories={}, headerOverrides={}, webhooks={}",
                    loaded.getPollingIntervalMs(),
                    loaded.getPatternCategories().keySet(),
                    loaded.getHeaderOverrides().size(),
                    loaded.getWebhookPolicy().isEnabled() ? "enabled" : "disabled");

            boolean intervalChanged = inUse.getPollingIntervalMs() != loaded.getPollingIntervalMs();
            if (intervalChanged) {
                log.info("Polling interval changed from {}ms to {}ms, requesting scheduler restart",
                        inUse.getPollingIntervalMs(), loaded.getPollingIntervalMs());
                eventPublisher.publishEvent(new PollingIntervalChangedEvent(
                        inUse.getPollingIntervalMs(), loaded.getPollingIntervalMs()));
            }

            return ConfigReloadResult.success(loaded, intervalChanged);
        }
    }

    /**
     * Effective settings for an item: header override, then the item's stored values,
     * then its category defaults, then built-in defaults
     */
    public ResolvedAlertSettings resolveSettings(MonitoredItem item) {
        MonitoringConfig config = current.get();
        HeaderOverride override = config.getHeaderOverrides().get(item.getHeaderId());
        CategorySettings category = item.getCategory() != null
                ? config.getPatternCategories().get(item.getCategory())
                : null;

        Double threshold = firstNonNull(
                override != null ? override.getThreshold() : null,
                item.getThreshold(),
                category != null ? category.getThreshold() : null);
        Long alertDuration = firstNonNull(
                override != null ? override.getAlertDurationMs() : null,
                item.getAlertDurationMs(),
                category != null ? category.getAlertDurationMs() : null);
        Long frozenThreshold = firstNonNull(
                override != null ? override.getFrozenThresholdMs() : null,
                item.getFrozenThresholdMs(),
                category != null ? category.getFrozenThresholdMs() : null);

        return new ResolvedAlertSettings(
                threshold,
                alertDuration != null ? alertDuration : defaultAlertDurationMs,
                frozenThreshold != null ? frozenThreshold : defaultFrozenThresholdMs,
                item.getCategory());
    }

    private MonitoringConfig loadFromStore(MonitoringConfig inUse) {
        StoredSettings stored;
        Map<String, HeaderOverride> overrides;
        try {
            stored = settingsRepository.findLatest().orElse(null);
            overrides = settingsRepository.findHeaderOverrides();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read monitoring settings: " + e.getMessage(), e);
        }

        if (stored == null) {
            log.warn("No monitoring settings found in store, using defaults");
            stored = StoredSettings.builder()
                    .pollingIntervalMs(MonitoringConfig.DEFAULT_POLLING_INTERVAL_MS)
                    .lastUpdated(Instant.now())
                    .build();
        }

        return MonitoringConfig.builder()
                .pollingIntervalMs(validatePollingInterval(stored.getPollingIntervalMs()))
                .patternCategories(parseCategoriesOrFallback(stored.getPatternCategoriesJson(), inUse))
                .headerOverrides(overrides)
                .webhookPolicy(parseWebhookPolicyOrFallback(stored.getWebhooksJson(), inUse))
                .lastUpdated(stored.getLastUpdated())
                .build();
    }

    long validatePollingInterval(Long pollingIntervalMs) {
        if (pollingIntervalMs == null || pollingIntervalMs < MonitoringConfig.MIN_POLLING_INTERVAL_MS) {
            log.warn("Invalid polling interval ({}), defaulting to {}ms",
                    pollingIntervalMs, MonitoringConfig.DEFAULT_POLLING_INTERVAL_MS);
            return MonitoringConfig.DEFAULT_POLLING_INTERVAL_MS;
        }
        return pollingIntervalMs;
    }

    private Map<String, CategorySettings> parseCategoriesOrFallback(String json, MonitoringConfig inUse) {
        if (json == null || json.isBlank()) {
            log.warn("No pattern categories stored, keeping current categories");
            return inUse.getPatternCategories();
        }
        try {
            return parseCategories(json);
        } catch (ConfigValidationException e) {
            log.warn("Invalid patternCategories, keeping current categories: {}", e.getMessage());
            return inUse.getPatternCategories();
        }
    }

    Map<String, CategorySettings> parseCategories(String json) {
        JsonNode root = readObject(json, "patternCategories");

        Map<String, CategorySettings> categories = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            if (!node.isObject()) {
                throw new ConfigValidationException("Category '" + field.getKey() + "' is not an object");
            }
            categories.put(field.getKey(), CategorySettings.builder()
                    .patterns(stringList(node.get("patterns")))
                    .negativePatterns(stringList(node.get("negativePatterns")))
                    .threshold(numberOrNull(node.get("threshold")))
                    .alertDurationMs(DurationUnits.secondsToMillis(numberOrNull(node.get("alertDuration"))))
                    .frozenThresholdMs(DurationUnits.secondsToMillis(numberOrNull(node.get("frozenThreshold"))))
                    .notificationIntervalMs(DurationUnits.secondsToMillis(numberOrNull(node.get("notificationInterval"))))
                    .build());
        }
        return categories;
    }

    private WebhookPolicy parseWebhookPolicyOrFallback(String json, MonitoringConfig inUse) {
        if (json == null || json.isBlank()) {
            return inUse.getWebhookPolicy();
        }
        try {
            return parseWebhookPolicy(json);
        } catch (ConfigValidationException e) {
            log.warn("Invalid webhook settings, keeping current policy: {}", e.getMessage());
            return inUse.getWebhookPolicy();
        }
    }

    WebhookPolicy parseWebhookPolicy(String json) {
        JsonNode root = readObject(json, "webhooks");
        return WebhookPolicy.builder()
                .enabled(root.path("enabled").asBoolean(false))
                .slackEnabled(root.path("slackEnabled").asBoolean(true))
                .teamsEnabled(root.path("teamsEnabled").asBoolean(false))
                .slackWebhookUrl(textOrNull(root.get("slackWebhookUrl")))
                .teamsWebhookUrl(textOrNull(root.get("teamsWebhookUrl")))
                .customWebhooks(stringList(root.get("customWebhooks")))
                .sendThresholdAlerts(root.path("sendThresholdAlerts").asBoolean(true))
                .sendFrozenAlerts(root.path("sendFrozenAlerts").asBoolean(true))
                .sendErrorAlerts(root.path("sendErrorAlerts").asBoolean(true))
                .build();
    }

    private JsonNode readObject(String json, String section) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigValidationException("Malformed " + section + " JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigValidationException(section + " must be a JSON object");
        }
        return root;
    }

    // Malformed pattern lists count as empty
    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode element : node) {
            if (element.isTextual() && !element.asText().isBlank()) {
                values.add(element.asText());
            }
        }
        return values;
    }

    private static Double numberOrNull(JsonNode node) {
        return node != null && node.isNumber() ? node.asDouble() : null;
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
