package com.company.pmm.controller;

import com.company.pmm.domain.Signal;
import com.company.pmm.domain.enums.SignalStatus;
import com.company.pmm.dto.request.ResolveRequest;
import com.company.pmm.dto.request.AcknowledgeRequest;
import com.company.pmm.dto.response.DetectionRunResponse;
import com.company.pmm.dto.response.SignalListResponse;
import com.company.pmm.service.SignalService;
import com.company.pmm.util.TimeUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/signals")
@Tag(name = "Signals", description = "Detected anomalies, trend changes and patterns")
@RequiredArgsConstructor
@Validated
@Slf4j
public class SignalController {

    private final SignalService signalService;

    @RequestMapping(value = "/detect", method = {RequestMethod.GET, RequestMethod.POST})
    @Operation(summary = "Run a detection pass over every tracked metric")
    public ResponseEntity<DetectionRunResponse> detect() {
        log.debug("On-demand detection pass requested");
        return ResponseEntity.ok(signalService.runDetection());
    }

    @GetMapping("/history")
    @Operation(summary = "Signals detected within the last N hours")
    public ResponseEntity<SignalListResponse> getHistory(
            @Parameter(description = "active, acknowledged, resolved or false_positive")
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "168") @Min(1) @Max(24 * 90) int hours) {
        SignalStatus filter = status != null ? SignalStatus.fromValue(status) : null;
        return ResponseEntity.ok(SignalListResponse.of(signalService.getHistory(filter, TimeUtils.hours(hours))));
    }

    @GetMapping("/active")
    @Operation(summary = "Signals awaiting acknowledgement")
    public ResponseEntity<SignalListResponse> getActive() {
        return ResponseEntity.ok(SignalListResponse.of(signalService.getActiveSignals()));
    }

    @GetMapping("/{signalId}")
    @Operation(summary = "Signal detail")
    public ResponseEntity<Signal> getSignal(@PathVariable String signalId) {
        return ResponseEntity.ok(signalService.getSignal(signalId));
    }

    @PostMapping("/{signalId}/acknowledge")
    @Operation(summary = "Acknowledge a signal")
    public ResponseEntity<Signal> acknowledge(@PathVariable String signalId,
                                              @Valid @RequestBody AcknowledgeRequest request) {
        return ResponseEntity.ok(signalService.acknowledge(signalId, request.getAcknowledgedBy()));
    }

    @PostMapping("/{signalId}/resolve")
    @Operation(summary = "Resolve a signal")
    public ResponseEntity<Signal> resolve(@PathVariable String signalId, @Valid @RequestBody ResolveRequest request) {
        return ResponseEntity.ok(signalService.resolve(signalId, request.getResolvedBy()));
    }

    @PostMapping("/{signalId}/false-positive")
    @Operation(summary = "Mark a signal as a false positive")
    public ResponseEntity<Signal> markFalsePositive(@PathVariable String signalId,
                                                    @Valid @RequestBody ResolveRequest request) {
        return ResponseEntity.ok(signalService.markFalsePositive(signalId, request.getResolvedBy()));
    }
}
