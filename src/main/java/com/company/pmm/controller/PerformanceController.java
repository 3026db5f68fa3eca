package com.company.pmm.controller;

import com.company.pmm.domain.PerformanceSnapshot;
import com.company.pmm.dto.response.RealtimePerformance;
import com.company.pmm.dto.response.SlaStatusResponse;
import com.company.pmm.dto.response.SnapshotHistoryResponse;
import com.company.pmm.service.PerformanceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/performance")
@Tag(name = "Performance", description = "Performance snapshots and SLA compliance")
@RequiredArgsConstructor
@Validated
public class PerformanceController {

    private final PerformanceService performanceService;

    @GetMapping("/realtime")
    @Operation(summary = "Latest snapshot with per-dimension SLA verdicts", description = "204 before the first snapshot")
    public ResponseEntity<RealtimePerformance> getRealtime() {
        return performanceService.getRealtime()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @GetMapping("/history")
    @Operation(summary = "Snapshots recorded in the last N hours")
    public ResponseEntity<SnapshotHistoryResponse> getHistory(
            @RequestParam(defaultValue = "24") @Min(1) @Max(168) int hours) {
        List<PerformanceSnapshot> snapshots = performanceService.getHistory(hours);
        return ResponseEntity.ok(new SnapshotHistoryResponse(hours, snapshots.size(), snapshots));
    }

    @GetMapping("/sla")
    @Operation(summary = "SLA compliance over a period", description = "Defaults to the configured period (24h)")
    public ResponseEntity<SlaStatusResponse> getSlaStatus(
            @RequestParam(required = false) @Min(1) @Max(168) Integer hours) {
        return ResponseEntity.ok(performanceService.getSlaStatus(hours));
    }
}
