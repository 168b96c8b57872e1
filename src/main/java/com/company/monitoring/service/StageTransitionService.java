package com.company.monitoring.service;

import com.company.monitoring.client.TelemetryClient;
import com.company.monitoring.domain.ActiveStage;
import com.company.monitoring.domain.HeaderSettingsRecord;
import com.company.monitoring.domain.StageHeader;
import com.company.monitoring.exception.TelemetryApiException;
import com.company.monitoring.repository.ActiveProjectRepository;
import com.company.monitoring.repository.MonitoredHeaderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Moves monitoring to the headers of a project's new stage when the telemetry API reports
 * a different active stage than the one stored in {@code active_projects}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StageTransitionService {

    private final TelemetryClient telemetryClient;
    private final ActiveProjectRepository activeProjectRepository;
    private final MonitoredHeaderRepository headerRepository;
    private final MonitoredItemRegistry registry;

    /**
     * @return number of projects whose stage changed
     */
    public int detectTransitions() {
        log.debug("Checking for stage transitions...");

        List<ActiveStage> activeStages;
        try {
            activeStages = telemetryClient.fetchActiveStages();
        } catch (TelemetryApiException e) {
            log.warn("Skipping stage transition check: {}", e.getMessage());
            return 0;
        }

        int transitions = 0;
        try {
            Map<String, String> previousStages = activeProjectRepository.findCurrentStages();
            List<ActiveStage> valid = new ArrayList<>();

            for (ActiveStage stage : activeStages) {
                if (stage.getProjectId() == null || stage.getStageId() == null) {
                    continue;
                }
                valid.add(stage);

                String previousStageId = previousStages.get(stage.getProjectId());
                if (previousStageId != null && !previousStageId.equals(stage.getStageId())) {
                    log.info("Stage transition detected for project {}: {} -> {}",
                            stage.getProjectId(), previousStageId, stage.getStageId());
                    if (migrateHeaders(stage.getProjectId(), previousStageId, stage.getStageId())) {
                        transitions++;
                    }
                }
            }

            activeProjectRepository.upsertActiveStages(valid);
        } catch (DataAccessException e) {
            log.error("Store error during stage transition check", e);
        }
        return transitions;
    }

    /**
     * Carries the settings of each monitored header of the project to its counterpart in the
     * new stage. Old headers without a counterpart stop being monitored.
     */
    boolean migrateHeaders(String projectId, String oldStageId, String newStageId) {
        List<HeaderSettingsRecord> oldHeaders = headerRepository.findMonitoredByProject(projectId);
        if (oldHeaders.isEmpty()) {
            log.info("No monitored headers for project {} on stage {}", projectId, oldStageId);
            return true;
        }

        List<StageHeader> newHeaders;
        try {
            newHeaders = telemetryClient.fetchStageHeaders(newStageId);
        } catch (TelemetryApiException e) {
            log.error("Failed to fetch headers for new stage {}, monitoring left on stage {}: {}",
                    newStageId, oldStageId, e.getMessage());
            return false;
        }

        HeaderNameMatcher matcher = new HeaderNameMatcher(oldHeaders);
        Set<String> migrated = new HashSet<>();

        for (StageHeader newHeader : newHeaders) {
            Optional<HeaderNameMatcher.Match> match = matcher.match(newHeader.getName());
            if (match.isEmpty()) {
                continue;
            }
            HeaderSettingsRecord old = match.get().getHeader();
            migrated.add(old.getHeaderId());
            if (old.getHeaderId().equals(newHeader.getId())) {
                continue;
            }

            log.info("Migrating \"{}\" ({}) -> \"{}\" ({}) using {} match", old.getHeaderName(), old.getHeaderId(),
                    newHeader.getName(), newHeader.getId(), match.get().getStrategy());

            headerRepository.disableMonitoring(projectId, old.getHeaderId());
            headerRepository.upsertHeaderSettings(HeaderSettingsRecord.builder()
                    .projectId(projectId)
                    .headerId(newHeader.getId())
                    .headerName(newHeader.getName())
                    .threshold(old.getThreshold())
                    .alertDurationMs(old.getAlertDurationMs())
                    .frozenThresholdMs(old.getFrozenThresholdMs())
                    .monitored(true)
                    .build());
            registry.clearFrozenState(old.getHeaderId());
        }

        for (HeaderSettingsRecord old : oldHeaders) {
            if (!migrated.contains(old.getHeaderId())) {
                log.info("No matching header for \"{}\" ({}) on stage {}, disabling monitoring",
                        old.getHeaderName(), old.getHeaderId(), newStageId);
                headerRepository.disableMonitoring(projectId, old.getHeaderId());
                registry.clearFrozenState(old.getHeaderId());
            }
        }

        log.info("Completed stage transition for project {}: {} -> {}, {} of {} headers migrated",
                projectId, oldStageId, newStageId, migrated.size(), oldHeaders.size());
        return true;
    }
}
