package com.company.monitoring.domain;

import lombok.Value;

import java.time.Instant;

/**
 * Most recent value read for a header. {@code changedAt} is when the value last differed from
 * the previous reading, {@code timestamp} when it was last read.
 */
@Value
public class LastObservedValue {
    Object value;
    Instant timestamp;
    Instant changedAt;
}
