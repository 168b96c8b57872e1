package com.company.monitoring.controller;

import com.company.monitoring.domain.HealthStatus;
import com.company.monitoring.service.HealthStatusTracker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Health check endpoints")
public class HealthController {

    private final HealthStatusTracker healthTracker;

    @GetMapping
    @Operation(summary = "Monitoring health snapshot", description = "Returns 503 while monitoring is unhealthy")
    public ResponseEntity<HealthStatus> health() {
        HealthStatus status = healthTracker.snapshot();
        return ResponseEntity
                .status(status.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(status);
    }
}
