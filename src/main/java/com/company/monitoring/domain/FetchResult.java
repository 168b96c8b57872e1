package com.company.monitoring.domain;

import com.company.monitoring.domain.enums.FetchErrorType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a single telemetry read. Failures are carried as values, never thrown.
 */
@Value
@Builder
public class FetchResult {
    String headerId;
    Object value;
    Instant timestamp;
    FetchErrorType errorType;
    String error;
    int totalPoints;

    public boolean isError() {
        return errorType != null;
    }

    /**
     * True when the value should still be evaluated. No-content responses carry a null value
     * that is tracked for frozen-state continuity.
     */
    public boolean isEvaluable() {
        return errorType == null || errorType == FetchErrorType.NO_CONTENT;
    }

    public static FetchResult success(String headerId, Object value, Instant timestamp, int totalPoints) {
        return FetchResult.builder()
                .headerId(headerId)
                .value(value)
                .timestamp(timestamp)
                .totalPoints(totalPoints)
                .build();
    }

    public static FetchResult failure(String headerId, FetchErrorType type, String error, Instant timestamp) {
        return FetchResult.builder()
                .headerId(headerId)
                .timestamp(timestamp)
                .errorType(type)
                .error(error)
                .build();
    }
}
