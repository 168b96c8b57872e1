package com.company.monitoring.repository;

import com.company.monitoring.domain.ActiveStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
@Slf4j
public class ActiveProjectRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Last known stage per project, as project id to stage id
     */
    public Map<String, String> findCurrentStages() {
        String sql = """
            SELECT project_id, stage_id
            FROM active_projects
            WHERE is_deleted = false AND stage_id IS NOT NULL
            """;

        Map<String, String> stages = new HashMap<>();
        jdbcTemplate.query(sql, rs -> {
            stages.put(rs.getString("project_id"), rs.getString("stage_id"));
        });
        return stages;
    }

    public Optional<String> findProjectIdByStage(String stageId) {
        List<String> results = jdbcTemplate.queryForList(
                "SELECT project_id FROM active_projects WHERE stage_id = ?", String.class, stageId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Insert or refresh active projects with the stages reported by the telemetry API
     */
    public int upsertActiveStages(List<ActiveStage> stages) {
        if (stages.isEmpty()) {
            return 0;
        }

        String sql = """
            INSERT INTO active_projects (
                project_id, project_name, company_id, company_name,
                stage_id, stage_name, is_deleted, last_updated
            ) VALUES (?, ?, ?, ?, ?, ?, false, ?)
            ON CONFLICT (project_id) DO UPDATE SET
                project_name = EXCLUDED.project_name,
                company_id = EXCLUDED.company_id,
                company_name = EXCLUDED.company_name,
                stage_id = EXCLUDED.stage_id,
                stage_name = EXCLUDED.stage_name,
                is_deleted = false,
                last_updated = EXCLUDED.last_updated
            """;

        Timestamp now = Timestamp.from(Instant.now());
        List<Object[]> batchArgs = stages.stream()
                .map(stage -> new Object[]{
                        stage.getProjectId(),
                        stage.getProjectName(),
                        stage.getCompanyId(),
                        stage.getCompanyName(),
                        stage.getStageId(),
                        stage.getStageName(),
                        now
                })
                .collect(Collectors.toList());

        int[] updated = jdbcTemplate.batchUpdate(sql, batchArgs);
        log.debug("Upserted {} active projects", updated.length);
        return updated.length;
    }
}
