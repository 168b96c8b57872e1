package com.company.monitoring.scheduled;

import com.company.monitoring.domain.ConfigReloadResult;
import com.company.monitoring.service.MonitoringConfigManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic forced reload, so settings edited directly in the store are picked up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfigReloadJob {

    private final MonitoringConfigManager configManager;

    @Scheduled(
            fixedDelayString = "${monitoring.config.forced-reload-interval-ms:900000}",
            initialDelayString = "${monitoring.config.forced-reload-interval-ms:900000}"
    )
    public void forceReload() {
        log.debug("Forced configuration reload");
        ConfigReloadResult result = configManager.reload();
        if (!result.isSuccess()) {
            log.warn("Forced configuration reload failed, keeping current settings: {}", result.getError());
        }
    }
}
