package com.company.pmm.controller;

import com.company.pmm.domain.Alert;
import com.company.pmm.dto.request.ResolveRequest;
import com.company.pmm.dto.request.AcknowledgeRequest;
import com.company.pmm.dto.response.AlertListResponse;
import com.company.pmm.service.AlertService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Threshold alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertService alertService;

    @GetMapping("/active")
    @Operation(summary = "Alerts that are not yet resolved")
    public ResponseEntity<AlertListResponse> getActiveAlerts() {
        return ResponseEntity.ok(AlertListResponse.of(alertService.getActiveAlerts()));
    }

    @GetMapping("/{alertId}")
    @Operation(summary = "Alert detail")
    public ResponseEntity<Alert> getAlert(@PathVariable String alertId) {
        return ResponseEntity.ok(alertService.getAlert(alertId));
    }

    @PostMapping("/{alertId}/acknowledge")
    @Operation(summary = "Acknowledge an alert")
    public ResponseEntity<Alert> acknowledge(@PathVariable String alertId,
                                             @Valid @RequestBody AcknowledgeRequest request) {
        return ResponseEntity.ok(alertService.acknowledge(alertId, request.getAcknowledgedBy()));
    }

    @PostMapping("/{alertId}/resolve")
    @Operation(summary = "Resolve an alert")
    public ResponseEntity<Alert> resolve(@PathVariable String alertId, @Valid @RequestBody ResolveRequest request) {
        return ResponseEntity.ok(alertService.resolve(alertId, request.getResolvedBy()));
    }
}
