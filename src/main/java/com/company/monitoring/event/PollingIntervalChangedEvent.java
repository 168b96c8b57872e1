package com.company.monitoring.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PollingIntervalChangedEvent {
    private final long previousIntervalMs;
    private final long newIntervalMs;
}
