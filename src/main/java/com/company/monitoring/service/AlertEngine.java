package com.company.monitoring.service;

import com.company.monitoring.domain.AlertEvent;
import com.company.monitoring.domain.AlertTimerState;
import com.company.monitoring.domain.FetchResult;
import com.company.monitoring.domain.FrozenTrackState;
import com.company.monitoring.domain.LastObservedValue;
import com.company.monitoring.domain.MonitoredItem;
import com.company.monitoring.domain.ResolvedAlertSettings;
import com.company.monitoring.domain.enums.AlertRepeatMode;
import com.company.monitoring.domain.enums.AlertType;
import com.company.monitoring.util.DurationUnits;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates fetched header values against the threshold and frozen-data state machines.
 *
 * <p>Must only be called from the cycle thread: state objects held by the registry are
 * mutated in place without locking.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertEngine {

    private final MonitoredItemRegistry registry;
    private final MonitoringConfigManager configManager;
    private final MeterRegistry meterRegistry;

    @Value("${monitoring.alerts.repeat-mode:LATCHED}")
    private String repeatMode = "LATCHED";

    public List<AlertEvent> evaluateAll(Collection<FetchResult> results, Instant now) {
        List<AlertEvent> alerts = new ArrayList<>();
        for (FetchResult result : results) {
            alerts.addAll(evaluate(result, now));
        }
        return alerts;
    }

    public List<AlertEvent> evaluate(FetchResult result, Instant now) {
        Optional<MonitoredItem> found = registry.find(result.getHeaderId());
        if (found.isEmpty()) {
            log.debug("Skipping header {}: not monitored", result.getHeaderId());
            return List.of();
        }
        MonitoredItem item = found.get();
        List<AlertEvent> alerts = new ArrayList<>();

        if (!result.isEvaluable()) {
            boolean newStreak = registry.markFetchError(item.getHeaderId());
            if (newStreak || repeatMode() == AlertRepeatMode.REPEAT) {
                alerts.add(buildAlert(item, AlertType.ERROR, null, null, now,
                        String.format("Failed to read %s: %s (%s)",
                                item.getHeaderName(), result.getError(), result.getErrorType())));
            }
            countAlerts(alerts);
            return alerts;
        }
        registry.clearFetchError(item.getHeaderId());

        ResolvedAlertSettings settings = configManager.resolveSettings(item);
        Object value = result.getValue();

        checkThreshold(item, settings, value, now).ifPresent(alerts::add);
        checkFrozen(item, settings, value, now).ifPresent(alerts::add);
        registry.recordLastValue(item.getHeaderId(), value, now);

        countAlerts(alerts);
        return alerts;
    }

    Optional<AlertEvent> checkThreshold(MonitoredItem item, ResolvedAlertSettings settings, Object value, Instant now) {
        Double threshold = settings.getThreshold();
        Double numeric = toDouble(value);
        if (threshold == null || numeric == null) {
            return Optional.empty();
        }

        AlertTimerState state = registry.alertTimer(item.getHeaderId()).orElse(null);
        if (state == null) {
            // First observation never fires
            registry.putAlertTimer(item.getHeaderId(), AlertTimerState.builder()
                    .active(false)
                    .lastValue(value)
                    .category(settings.getCategory())
                    .lastObservedAt(now)
                    .build());
            log.debug("Header {} first observation {} (threshold {})", item.getHeaderId(), value, threshold);
            return Optional.empty();
        }

        state.setLastValue(value);
        state.setLastObservedAt(now);
        state.setCategory(settings.getCategory());

        if (numeric >= threshold) {
            if (state.isActive()) {
                log.info("Header {} ({}) recovered: {} >= {}", item.getHeaderId(), item.getHeaderName(), value, threshold);
            }
            state.setActive(false);
            state.setFired(false);
            state.setStartTime(null);
            return Optional.empty();
        }

        if (!state.isActive()) {
            state.setActive(true);
            state.setStartTime(now);
            log.debug("Header {} below threshold: {} < {}, alert window started", item.getHeaderId(), value, threshold);
            return Optional.empty();
        }

        long elapsedMs = Duration.between(state.getStartTime(), now).toMillis();
        if (elapsedMs < settings.getAlertDurationMs()) {
            log.debug("Header {} below threshold for {} of {}", item.getHeaderId(),
                    DurationUnits.formatDuration(elapsedMs), DurationUnits.formatDuration(settings.getAlertDurationMs()));
            return Optional.empty();
        }
        if (state.isFired() && repeatMode() == AlertRepeatMode.LATCHED) {
            return Optional.empty();
        }

        state.setFired(true);
        log.warn("Threshold alert: {} ({}) = {} below {} for {}", item.getHeaderName(), item.getHeaderId(),
                value, threshold, DurationUnits.formatDuration(elapsedMs));
        return Optional.of(buildAlert(item, AlertType.THRESHOLD, value, threshold, now,
                String.format("%s is %s, below threshold %s for %s",
                        item.getHeaderName(), value, threshold, DurationUnits.formatDuration(elapsedMs))));
    }

    Optional<AlertEvent> checkFrozen(MonitoredItem item, ResolvedAlertSettings settings, Object value, Instant now) {
        FrozenTrackState state = registry.frozenState(item.getHeaderId()).orElse(null);
        if (state == null) {
            registry.putFrozenState(item.getHeaderId(), FrozenTrackState.builder()
                    .lastValue(value)
                    .lastChangeTime(initialChangeTime(item.getHeaderId(), value, now))
                    .category(settings.getCategory())
                    .lastObservedAt(now)
                    .build());
            return Optional.empty();
        }

        state.setLastObservedAt(now);
        state.setCategory(settings.getCategory());

        if (!Objects.equals(value, state.getLastValue())) {
            state.setLastValue(value);
            state.setLastChangeTime(now);
            state.setFired(false);
            return Optional.empty();
        }

        long elapsedMs = Duration.between(state.getLastChangeTime(), now).toMillis();
        if (elapsedMs < settings.getFrozenThresholdMs()) {
            return Optional.empty();
        }
        if (state.isFired() && repeatMode() == AlertRepeatMode.LATCHED) {
            return Optional.empty();
        }

        state.setFired(true);
        log.warn("Frozen data: {} ({}) unchanged at {} for {}", item.getHeaderName(), item.getHeaderId(),
                value, DurationUnits.formatDuration(elapsedMs));
        return Optional.of(buildAlert(item, AlertType.FROZEN, value, null, now,
                String.format("%s has not changed from %s for %s",
                        item.getHeaderName(), value, DurationUnits.formatDuration(elapsedMs))));
    }

    /**
     * A cached value that survived a scheduler restart keeps the frozen window running
     */
    private Instant initialChangeTime(String headerId, Object value, Instant now) {
        Optional<LastObservedValue> cached = registry.lastValue(headerId);
        if (cached.isPresent()
                && Objects.equals(cached.get().getValue(), value)
                && cached.get().getChangedAt() != null
                && cached.get().getChangedAt().isBefore(now)) {
            return cached.get().getChangedAt();
        }
        return now;
    }

    private AlertEvent buildAlert(MonitoredItem item, AlertType type, Object value, Double threshold,
                                  Instant now, String message) {
        return AlertEvent.builder()
                .headerId(item.getHeaderId())
                .headerName(item.getHeaderName())
                .type(type)
                .value(value)
                .threshold(threshold)
                .timestamp(now)
                .companyId(item.getCompanyId())
                .stageId(item.getStageId())
                .message(message)
                .build();
    }

    private void countAlerts(List<AlertEvent> alerts) {
        for (AlertEvent alert : alerts) {
            meterRegistry.counter("monitoring.alerts.raised", "type", alert.getType().wireName()).increment();
        }
    }

    AlertRepeatMode repeatMode() {
        return AlertRepeatMode.fromString(repeatMode);
    }

    static Double toDouble(Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        return null;
    }
}
