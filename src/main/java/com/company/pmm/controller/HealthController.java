package com.company.pmm.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness of the service process. Monitored-system health lives under /api/v1/dashboard.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service liveness")
@RequiredArgsConstructor
public class HealthController {

    private final Clock clock;

    @GetMapping
    @Operation(summary = "Service liveness")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("timestamp", clock.instant());
        response.put("service", "pmm-service");
        response.put("version", "1.0.0");

        return ResponseEntity.ok(response);
    }
}
