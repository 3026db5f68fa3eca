package com.company.pmm.controller;

import com.company.pmm.domain.PerformanceSnapshot;
import com.company.pmm.dto.request.FeedbackRequest;
import com.company.pmm.dto.request.InteractionRequest;
import com.company.pmm.dto.request.MetricRecordRequest;
import com.company.pmm.dto.request.PerformanceSnapshotRequest;
import com.company.pmm.dto.response.IngestionSummary;
import com.company.pmm.service.IngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Ingestion", description = "Interaction, feedback, performance and metric ingestion")
@RequiredArgsConstructor
@Slf4j
public class IngestionController {

    private final IngestionService ingestionService;

    @PostMapping("/interactions/log")
    @Operation(
            summary = "Log an AI interaction",
            description = "Records response time and any upstream-evaluated metrics, then checks them against their bands"
    )
    public ResponseEntity<IngestionSummary> logInteraction(@Valid @RequestBody InteractionRequest request) {
        IngestionSummary summary = ingestionService.logInteraction(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(summary);
    }

    @PostMapping("/feedback/submit")
    @Operation(summary = "Submit user feedback", description = "Rating 1-5, recorded as user_satisfaction = rating / 5")
    public ResponseEntity<IngestionSummary> submitFeedback(@Valid @RequestBody FeedbackRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ingestionService.submitFeedback(request));
    }

    @PostMapping("/performance/snapshots")
    @Operation(summary = "Record a performance snapshot")
    public ResponseEntity<PerformanceSnapshot> recordSnapshot(@Valid @RequestBody PerformanceSnapshotRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ingestionService.recordPerformanceSnapshot(request));
    }

    @PostMapping("/metrics/record")
    @Operation(summary = "Record a single metric value")
    public ResponseEntity<IngestionSummary> recordMetric(@Valid @RequestBody MetricRecordRequest request) {
        log.debug("Direct metric record {}={}", request.getMetricName(), request.getValue());
        return ResponseEntity.status(HttpStatus.CREATED).body(ingestionService.recordMetric(request));
    }
}
