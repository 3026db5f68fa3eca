package com.company.pmm.controller;

import com.company.pmm.dto.response.DashboardOverview;
import com.company.pmm.dto.response.KpiSummary;
import com.company.pmm.dto.response.SystemStats;
import com.company.pmm.service.DashboardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Dashboard", description = "Health overview, KPIs and statistics")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;

    @GetMapping("/dashboard/overview")
    @Operation(summary = "Health score, active signal and alert counts, trends summary")
    public ResponseEntity<DashboardOverview> getOverview() {
        // Health is recomputed per request and must never be served from a cache
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(dashboardService.getOverview());
    }

    @GetMapping("/dashboard/kpis")
    @Operation(summary = "Interaction, feedback, metric, alert and signal KPIs")
    public ResponseEntity<KpiSummary> getKpis() {
        return ResponseEntity.ok(dashboardService.getKpis());
    }

    @GetMapping("/stats")
    @Operation(summary = "System totals")
    public ResponseEntity<SystemStats> getStats() {
        return ResponseEntity.ok(dashboardService.getStats());
    }
}
