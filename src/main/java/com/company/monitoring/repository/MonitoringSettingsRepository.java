package com.company.monitoring.repository;

import com.company.monitoring.domain.MonitoringConfig.HeaderOverride;
import com.company.monitoring.domain.StoredSettings;
import com.company.monitoring.util.DurationUnits;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class MonitoringSettingsRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Latest settings row, empty when none has been saved yet
     */
    public Optional<StoredSettings> findLatest() {
        String sql = """
            SELECT polling_interval_ms, pattern_categories, webhooks, last_updated
            FROM monitoring_settings
            ORDER BY id DESC
            LIMIT 1
            """;

        List<StoredSettings> results = jdbcTemplate.query(sql, new StoredSettingsRowMapper());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Per-header overrides keyed by header id. Durations are stored in seconds.
     */
    public Map<String, HeaderOverride> findHeaderOverrides() {
        String sql = """
            SELECT header_id, threshold, alert_duration, frozen_threshold
            FROM header_thresholds
            ORDER BY header_id
            """;

        Map<String, HeaderOverride> overrides = new LinkedHashMap<>();
        jdbcTemplate.query(sql, rs -> {
            overrides.put(rs.getString("header_id"), HeaderOverride.builder()
                    .threshold(rs.getObject("threshold", Double.class))
                    .alertDurationMs(DurationUnits.secondsToMillis(rs.getObject("alert_duration", Long.class)))
                    .frozenThresholdMs(DurationUnits.secondsToMillis(rs.getObject("frozen_threshold", Long.class)))
                    .build());
        });
        return overrides;
    }

    private static class StoredSettingsRowMapper implements RowMapper<StoredSettings> {
        @Override
        public StoredSettings mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp lastUpdated = rs.getTimestamp("last_updated");
            return StoredSettings.builder()
                    .pollingIntervalMs(rs.getObject("polling_interval_ms", Long.class))
                    .patternCategoriesJson(rs.getString("pattern_categories"))
                    .webhooksJson(rs.getString("webhooks"))
                    .lastUpdated(lastUpdated != null ? lastUpdated.toInstant() : null)
                    .build();
        }
    }
}
