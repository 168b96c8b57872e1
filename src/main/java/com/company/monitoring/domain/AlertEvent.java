package com.company.monitoring.domain;

import com.company.monitoring.domain.enums.AlertType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AlertEvent {
    @Builder.Default
    String id = UUID.randomUUID().toString();
    String headerId;
    String headerName;
    AlertType type;
    Object value;
    Double threshold;
    Instant timestamp;
    String companyId;
    String stageId;
    String message;
}
