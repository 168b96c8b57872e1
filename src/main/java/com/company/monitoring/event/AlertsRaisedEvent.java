package com.company.monitoring.event;

import com.company.monitoring.domain.AlertEvent;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Published once per cycle with the events produced by that cycle.
 */
@Getter
@AllArgsConstructor
public class AlertsRaisedEvent {
    private final String cycleId;
    private final List<AlertEvent> alerts;
}
