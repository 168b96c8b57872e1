package com.company.monitoring.repository;

import com.company.monitoring.domain.HeaderSettingsRecord;
import com.company.monitoring.domain.MonitoredItem;
import com.company.monitoring.util.DurationUnits;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
@RequiredArgsConstructor
@Slf4j
public class MonitoredHeaderRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String MONITORED_JOIN = """
        FROM project_header_settings phs
        JOIN active_projects ap ON phs.project_id = ap.project_id
        WHERE phs.is_monitored = true
        AND ap.is_deleted = false
        """;

    /**
     * Authoritative set of monitored headers, restricted to non-deleted projects
     */
    public List<MonitoredItem> findMonitoredHeaders() {
        String sql = """
            SELECT phs.header_id, phs.header_name, phs.project_id,
                   phs.threshold, phs.alert_duration, phs.frozen_threshold,
                   ap.company_id, ap.stage_id
            """ + MONITORED_JOIN + " ORDER BY phs.header_id";

        return jdbcTemplate.query(sql, new MonitoredItemRowMapper());
    }

    public int countMonitored() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(DISTINCT phs.header_id) " + MONITORED_JOIN, Integer.class);
        return count != null ? count : 0;
    }

    /**
     * Cheap connectivity check
     */
    public boolean ping() {
        Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        return one != null && one == 1;
    }

    public List<String> findProjectsWithMonitoredHeaders() {
        String sql = """
            SELECT DISTINCT project_id
            FROM project_header_settings
            WHERE is_monitored = true
            ORDER BY project_id
            """;
        return jdbcTemplate.queryForList(sql, String.class);
    }

    public List<HeaderSettingsRecord> findMonitoredByProject(String projectId) {
        String sql = """
            SELECT project_id, header_id, header_name, threshold, alert_duration,
                   frozen_threshold, is_monitored, last_updated
            FROM project_header_settings
            WHERE project_id = ? AND is_monitored = true
            ORDER BY header_id
            """;
        return jdbcTemplate.query(sql, new HeaderSettingsRowMapper(), projectId);
    }

    public int disableMonitoring(String projectId, String headerId) {
        String sql = """
            UPDATE project_header_settings
            SET is_monitored = false,
                last_updated = ?
            WHERE project_id = ? AND header_id = ?
            """;
        return jdbcTemplate.update(sql, Timestamp.from(Instant.now()), projectId, headerId);
    }

    /**
     * Insert or update the settings of one header. Durations are persisted in seconds.
     */
    public void upsertHeaderSettings(HeaderSettingsRecord settings) {
        String sql = """
            INSERT INTO project_header_settings (
                project_id, header_id, header_name, threshold,
                alert_duration, frozen_threshold, is_monitored, last_updated
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (project_id, header_id) DO UPDATE SET
                header_name = EXCLUDED.header_name,
                threshold = EXCLUDED.threshold,
                alert_duration = EXCLUDED.alert_duration,
                frozen_threshold = EXCLUDED.frozen_threshold,
                is_monitored = EXCLUDED.is_monitored,
                last_updated = EXCLUDED.last_updated
            """;

        jdbcTemplate.update(sql,
                settings.getProjectId(),
                settings.getHeaderId(),
                settings.getHeaderName(),
                settings.getThreshold(),
                DurationUnits.millisToSeconds(settings.getAlertDurationMs()),
                DurationUnits.millisToSeconds(settings.getFrozenThresholdMs()),
                Boolean.TRUE.equals(settings.getMonitored()),
                Timestamp.from(Instant.now())
        );
    }

    private static class MonitoredItemRowMapper implements RowMapper<MonitoredItem> {
        @Override
        public MonitoredItem mapRow(ResultSet rs, int rowNum) throws SQLException {
            return MonitoredItem.builder()
                    .headerId(rs.getString("header_id"))
                    .headerName(rs.getString("header_name"))
                    .projectId(rs.getString("project_id"))
                    .companyId(rs.getString("company_id"))
                    .stageId(rs.getString("stage_id"))
                    .threshold(rs.getObject("threshold", Double.class))
                    .alertDurationMs(DurationUnits.secondsToMillis(rs.getObject("alert_duration", Long.class)))
                    .frozenThresholdMs(DurationUnits.secondsToMillis(rs.getObject("frozen_threshold", Long.class)))
                    .build();
        }
    }

    private static class HeaderSettingsRowMapper implements RowMapper<HeaderSettingsRecord> {
        @Override
        public HeaderSettingsRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp lastUpdated = rs.getTimestamp("last_updated");
            return HeaderSettingsRecord.builder()
                    .projectId(rs.getString("project_id"))
                    .headerId(rs.getString("header_id"))
                    .headerName(rs.getString("header_name"))
                    .threshold(rs.getObject("threshold", Double.class))
                    .alertDurationMs(DurationUnits.secondsToMillis(rs.getObject("alert_duration", Long.class)))
                    .frozenThresholdMs(DurationUnits.secondsToMillis(rs.getObject("frozen_threshold", Long.class)))
                    .monitored(rs.getBoolean("is_monitored"))
                    .lastUpdated(lastUpdated != null ? lastUpdated.toInstant() : null)
                    .build();
        }
    }
}
