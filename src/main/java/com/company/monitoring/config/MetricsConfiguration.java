package com.company.monitoring.config;

import com.company.monitoring.service.MonitoredItemRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Gauges over the in-memory monitoring state
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final MonitoredItemRegistry registry;

    @Bean
    public MeterBinder monitoringStateMetrics(MeterRegistry meterRegistry) {
        return (reg) -> {
            Gauge.builder("monitoring.items", registry, MonitoredItemRegistry::size)
                    .description("Number of monitored headers held in memory")
                    .register(reg);

            Gauge.builder("monitoring.state.alert.timers", registry, MonitoredItemRegistry::alertTimerCount)
                    .description("Threshold timer states currently tracked")
                    .register(reg);

            Gauge.builder("monitoring.state.frozen", registry, MonitoredItemRegistry::frozenStateCount)
                    .description("Frozen-data states currently tracked")
                    .register(reg);

            Gauge.builder("monitoring.state.last.values", registry, MonitoredItemRegistry::lastValueCount)
                    .description("Cached last observed values")
                    .register(reg);

            log.info("Monitoring state metrics registered");
        };
    }
}
