package com.company.monitoring.service;

import com.company.monitoring.domain.MonitoredItem;
import com.company.monitoring.domain.SyncResult;
import com.company.monitoring.domain.SyncStats;
import com.company.monitoring.repository.MonitoredHeaderRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Synchronises the in-memory registry with the monitored headers in the store.
 *
 * <p>Removals are applied first, then additions, then setting updates. A failed store query
 * leaves the registry exactly as it was.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RegistryReconciler {

    private final MonitoredHeaderRepository headerRepository;
    private final MonitoredItemRegistry registry;
    private final PatternClassifier classifier;
    private final HealthStatusTracker healthTracker;
    private final MeterRegistry meterRegistry;

    public synchronized SyncResult sync() {
        log.debug("Verifying monitored items match store state...");

        List<MonitoredItem> fromStore;
        try {
            fromStore = headerRepository.findMonitoredHeaders();
        } catch (DataAccessException e) {
            log.error("Store error fetching monitored headers, keeping current registry", e);
            meterRegistry.counter("monitoring.sync.failures").increment();
            return SyncResult.failure("Failed to fetch monitored headers: " + e.getMessage());
        }

        Map<String, MonitoredItem> storeById = new LinkedHashMap<>();
        for (MonitoredItem item : fromStore) {
            storeById.putIfAbsent(item.getHeaderId(), item);
        }
        Set<String> memoryIds = registry.headerIds();

        List<String> toRemove = new ArrayList<>();
        for (String headerId : memoryIds) {
            if (!storeById.containsKey(headerId)) {
                toRemove.add(headerId);
            }
        }

        List<MonitoredItem> toAdd = new ArrayList<>();
        List<MonitoredItem> toUpdate = new ArrayList<>();
        List<MonitoredItem> unchanged = new ArrayList<>();
        for (MonitoredItem stored : storeById.values()) {
            MonitoredItem existing = registry.find(stored.getHeaderId()).orElse(null);
            if (existing == null) {
                toAdd.add(stored);
            } else if (!existing.hasSameAlertSettings(stored)) {
                toUpdate.add(stored);
            } else {
                unchanged.add(stored);
            }
        }

        for (String headerId : toRemove) {
            log.info("Removing header {} no longer monitored in store", headerId);
            registry.remove(headerId);
        }

        for (MonitoredItem item : toAdd) {
            MonitoredItem classified = item.toBuilder()
                    .category(classifier.classify(item.getHeaderName()).orElse(null))
                    .build();
            log.info("Adding header {} ({}), category={}", item.getHeaderId(), item.getHeaderName(), classified.getCategory());
            registry.put(classified);
        }

        for (MonitoredItem item : toUpdate) {
            log.info("Updating settings for header {} ({})", item.getHeaderId(), item.getHeaderName());
            registry.put(merge(registry.find(item.getHeaderId()).orElse(item), item));
        }

        for (MonitoredItem item : unchanged) {
            MonitoredItem existing = registry.find(item.getHeaderId()).orElse(item);
            MonitoredItem refreshed = merge(existing, item);
            if (!refreshed.equals(existing)) {
                registry.put(refreshed);
            }
        }

        SyncStats stats = new SyncStats(toAdd.size(), toRemove.size(), toUpdate.size(), unchanged.size());
        if (stats.hasChanges()) {
            log.info("Monitored items synchronised with store: added={}, removed={}, updated={}, unchanged={}",
                    stats.getAdded(), stats.getRemoved(), stats.getUpdated(), stats.getUnchanged());
        } else {
            log.debug("Monitored items already in sync with store ({} items)", stats.getUnchanged());
        }

        meterRegistry.counter("monitoring.sync.added").increment(stats.getAdded());
        meterRegistry.counter("monitoring.sync.removed").increment(stats.getRemoved());
        meterRegistry.counter("monitoring.sync.updated").increment(stats.getUpdated());
        healthTracker.recordMonitoredItemCount(registry.size());

        return SyncResult.success(stats);
    }

    /**
     * Applies the stored settings and metadata on top of the in-memory item
     */
    private MonitoredItem merge(MonitoredItem existing, MonitoredItem stored) {
        return existing.toBuilder()
                .threshold(stored.getThreshold())
                .alertDurationMs(stored.getAlertDurationMs())
                .frozenThresholdMs(stored.getFrozenThresholdMs())
                .headerName(stored.getHeaderName())
                .projectId(stored.getProjectId())
                .companyId(stored.getCompanyId())
                .stageId(stored.getStageId())
                .category(classifier.classify(stored.getHeaderName()).orElse(null))
                .build();
    }
}
