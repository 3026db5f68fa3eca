package com.company.pmm.controller;

import com.company.pmm.dto.request.MetricsQueryRequest;
import com.company.pmm.dto.response.CurrentMetric;
import com.company.pmm.dto.response.MetricSummary;
import com.company.pmm.dto.response.TrendAnalysis;
import com.company.pmm.service.MetricsQueryService;
import com.company.pmm.util.TimeUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Metrics", description = "Current metric values, summaries, trends and forecasts")
@RequiredArgsConstructor
@Validated
public class MetricsController {

    private final MetricsQueryService metricsQueryService;

    @GetMapping("/metrics/current")
    @Operation(summary = "Latest value and recent average per metric")
    public ResponseEntity<Map<String, CurrentMetric>> getCurrentMetrics() {
        return ResponseEntity.ok(metricsQueryService.getCurrentMetrics());
    }

    @PostMapping("/metrics/query")
    @Operation(summary = "Summaries of selected metrics over a period")
    public ResponseEntity<Map<String, MetricSummary>> queryMetrics(@Valid @RequestBody MetricsQueryRequest request) {
        return ResponseEntity.ok(metricsQueryService.summarize(request.getMetricNames(), TimeUtils.hours(request.getHours())));
    }

    @GetMapping("/trends/metrics")
    @Operation(summary = "Trend analysis for every tracked metric")
    public ResponseEntity<Map<String, TrendAnalysis>> getTrends(
            @RequestParam(defaultValue = "24") @Min(1) @Max(720) int hours) {
        return ResponseEntity.ok(metricsQueryService.getAllTrends(TimeUtils.hours(hours)));
    }

    @GetMapping("/trends/forecast")
    @Operation(summary = "Trend and forecast for one metric", description = "404 when the metric has no data in the period")
    public ResponseEntity<TrendAnalysis> getForecast(
            @RequestParam("metric_name") String metricName,
            @RequestParam(defaultValue = "24") @Min(1) @Max(720) int hours) {
        return metricsQueryService.analyze(metricName, TimeUtils.hours(hours))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
