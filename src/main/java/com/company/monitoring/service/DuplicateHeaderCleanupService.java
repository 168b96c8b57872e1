package com.company.monitoring.service;

import com.company.monitoring.domain.HeaderSettingsRecord;
import com.company.monitoring.repository.MonitoredHeaderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Unmonitors headers that share a name with a newer header of the same project.
 * The header with the highest numeric id is kept.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DuplicateHeaderCleanupService {

    static final Comparator<String> HEADER_ID_ORDER = (a, b) -> {
        Long left = parseId(a);
        Long right = parseId(b);
        if (left != null && right != null) {
            return Long.compare(left, right);
        }
        return a.compareTo(b);
    };

    private final MonitoredHeaderRepository headerRepository;
    private final MonitoredItemRegistry registry;

    /**
     * @return number of headers that stopped being monitored
     */
    public int cleanupDuplicates() {
        log.debug("Starting duplicate header cleanup...");
        int removed = 0;
        try {
            for (String projectId : headerRepository.findProjectsWithMonitoredHeaders()) {
                removed += cleanupProject(projectId);
            }
        } catch (DataAccessException e) {
            log.error("Duplicate header cleanup failed", e);
            return 0;
        }

        if (removed > 0) {
            log.info("Duplicate header cleanup removed {} headers", removed);
        }
        return removed;
    }

    private int cleanupProject(String projectId) {
        List<HeaderSettingsRecord> headers = headerRepository.findMonitoredByProject(projectId);

        Map<String, List<HeaderSettingsRecord>> byName = headers.stream()
                .filter(h -> h.getHeaderName() != null)
                .collect(Collectors.groupingBy(
                        h -> HeaderNameMatcher.normalize(h.getHeaderName()),
                        LinkedHashMap::new,
                        Collectors.toList()));

        int removed = 0;
        for (Map.Entry<String, List<HeaderSettingsRecord>> group : byName.entrySet()) {
            List<HeaderSettingsRecord> instances = group.getValue();
            if (instances.size() < 2) {
                continue;
            }
            instances.sort(Comparator.comparing(HeaderSettingsRecord::getHeaderId, HEADER_ID_ORDER).reversed());
            HeaderSettingsRecord kept = instances.get(0);

            for (HeaderSettingsRecord duplicate : instances.subList(1, instances.size())) {
                headerRepository.disableMonitoring(projectId, duplicate.getHeaderId());
                registry.clearTrackingState(duplicate.getHeaderId());
                removed++;
                log.info("Unmonitored duplicate header {} '{}' in project {}, keeping {}",
                        duplicate.getHeaderId(), duplicate.getHeaderName(), projectId, kept.getHeaderId());
            }
        }
        return removed;
    }

    private static Long parseId(String id) {
        try {
            return Long.parseLong(id.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
