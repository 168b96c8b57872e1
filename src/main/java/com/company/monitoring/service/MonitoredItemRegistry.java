package com.company.monitoring.service;

import com.company.monitoring.domain.AlertEvent;
import com.company.monitoring.domain.AlertTimerState;
import com.company.monitoring.domain.FrozenTrackState;
import com.company.monitoring.domain.LastObservedValue;
import com.company.monitoring.domain.MonitoredItem;
import com.company.monitoring.domain.PruneStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory state of the monitoring engine: monitored items, per-header alert and frozen
 * tracking, the last observed value cache and a bounded list of recent alert events.
 *
 * <p>Items are written by the registry reconciler only. Alert and frozen state is written by the
 * alert engine on the cycle thread.
 */
@Component
@Slf4j
public class MonitoredItemRegistry {

    private final Map<String, MonitoredItem> items = new ConcurrentHashMap<>();
    private final Map<String, AlertTimerState> alertTimers = new ConcurrentHashMap<>();
    private final Map<String, FrozenTrackState> frozenStates = new ConcurrentHashMap<>();
    private final Map<String, LastObservedValue> lastValues = new ConcurrentHashMap<>();
    private final Set<String> headersInErrorStreak = ConcurrentHashMap.newKeySet();
    private final Deque<AlertEvent> recentAlerts = new ConcurrentLinkedDeque<>();

    @Value("${monitoring.state.max-recent-alerts:1000}")
    private int maxRecentAlerts = 1000;

    // --- monitored items ---

    public Optional<MonitoredItem> find(String headerId) {
        MonitoredItem item = items.get(headerId);
        return item != null ? Optional.of(item.toBuilder().build()) : Optional.empty();
    }

    public boolean isMonitored(String headerId) {
        return items.containsKey(headerId);
    }

    public List<MonitoredItem> snapshot() {
        return items.values().stream()
                .map(item -> item.toBuilder().build())
                .collect(Collectors.toList());
    }

    public Set<String> headerIds() {
        return Set.copyOf(items.keySet());
    }

    public int size() {
        return items.size();
    }

    void put(MonitoredItem item) {
        items.put(item.getHeaderId(), item.toBuilder().build());
    }

    /**
     * Drops the item together with any alert, frozen and error state keyed to it
     */
    void remove(String headerId) {
        items.remove(headerId);
        clearTrackingState(headerId);
    }

    public void clearTrackingState(String headerId) {
        alertTimers.remove(headerId);
        frozenStates.remove(headerId);
        headersInErrorStreak.remove(headerId);
    }

    // --- alert / frozen state ---

    public Optional<AlertTimerState> alertTimer(String headerId) {
        return Optional.ofNullable(alertTimers.get(headerId));
    }

    void putAlertTimer(String headerId, AlertTimerState state) {
        alertTimers.put(headerId, state);
    }

    public Optional<FrozenTrackState> frozenState(String headerId) {
        return Optional.ofNullable(frozenStates.get(headerId));
    }

    void putFrozenState(String headerId, FrozenTrackState state) {
        frozenStates.put(headerId, state);
    }

    public void clearFrozenState(String headerId) {
        frozenStates.remove(headerId);
    }

    /**
     * @return true when this is the first error of a new streak for the header
     */
    boolean markFetchError(String headerId) {
        return headersInErrorStreak.add(headerId);
    }

    void clearFetchError(String headerId) {
        headersInErrorStreak.remove(headerId);
    }

    public int alertTimerCount() {
        return alertTimers.size();
    }

    public int frozenStateCount() {
        return frozenStates.size();
    }

    /**
     * Clears alert and frozen tracking. The last observed value cache is kept.
     */
    public void clearAlertStates() {
        int timers = alertTimers.size();
        int frozen = frozenStates.size();
        alertTimers.clear();
        frozenStates.clear();
        headersInErrorStreak.clear();
        log.info("Cleared {} alert timer states and {} frozen states", timers, frozen);
    }

    // --- last observed values ---

    public void recordLastValue(String headerId, Object value, Instant timestamp) {
        lastValues.compute(headerId, (id, previous) -> {
            Instant changedAt = previous != null && previous.getChangedAt() != null
                    && Objects.equals(previous.getValue(), value)
                    ? previous.getChangedAt()
                    : timestamp;
            return new LastObservedValue(value, timestamp, changedAt);
        });
    }

    public Optional<LastObservedValue> lastValue(String headerId) {
        return Optional.ofNullable(lastValues.get(headerId));
    }

    public int lastValueCount() {
        return lastValues.size();
    }

    // --- recent alerts ---

    public void recordAlerts(Collection<AlertEvent> alerts) {
        for (AlertEvent alert : alerts) {
            recentAlerts.addLast(alert);
        }
        while (recentAlerts.size() > maxRecentAlerts) {
            recentAlerts.pollFirst();
        }
    }

    /**
     * Recent alert events, oldest first
     */
    public List<AlertEvent> recentAlerts() {
        return new ArrayList<>(recentAlerts);
    }

    // --- maintenance ---

    /**
     * Removes tracking state not observed within {@code maxAge}, alert events older than
     * {@code maxAge} and cached values of headers that are no longer monitored.
     */
    public PruneStats pruneStates(Instant now, Duration maxAge) {
        Instant cutoff = now.minus(maxAge);

        int alertPruned = removeIf(alertTimers, state -> isBefore(state.getLastObservedAt(), cutoff));
        int frozenPruned = removeIf(frozenStates, state -> isBefore(state.getLastObservedAt(), cutoff));

        int valuesPruned = 0;
        for (Iterator<String> it = lastValues.keySet().iterator(); it.hasNext(); ) {
            if (!items.containsKey(it.next())) {
                it.remove();
                valuesPruned++;
            }
        }

        int eventsPruned = 0;
        while (!recentAlerts.isEmpty() && isBefore(recentAlerts.peekFirst().getTimestamp(), cutoff)) {
            recentAlerts.pollFirst();
            eventsPruned++;
        }

        PruneStats stats = new PruneStats(alertPruned, frozenPruned, valuesPruned, eventsPruned);
        if (stats.total() > 0) {
            log.info("Pruned {} alert states, {} frozen states, {} cached values and {} alert events older than {}h",
                    alertPruned, frozenPruned, valuesPruned, eventsPruned, maxAge.toHours());
        }
        return stats;
    }

    private static <T> int removeIf(Map<String, T> map, Predicate<T> condition) {
        int removed = 0;
        for (Iterator<Map.Entry<String, T>> it = map.entrySet().iterator(); it.hasNext(); ) {
            if (condition.test(it.next().getValue())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private static boolean isBefore(Instant timestamp, Instant cutoff) {
        return timestamp != null && timestamp.isBefore(cutoff);
    }
}
