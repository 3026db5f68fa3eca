package com.company.pmm.controller;

import com.company.pmm.domain.Complaint;
import com.company.pmm.domain.enums.ComplaintPriority;
import com.company.pmm.domain.enums.ComplaintStatus;
import com.company.pmm.dto.request.ComplaintRequest;
import com.company.pmm.dto.request.ComplaintUpdateRequest;
import com.company.pmm.dto.response.ComplaintAnalytics;
import com.company.pmm.dto.response.ComplaintListResponse;
import com.company.pmm.service.ComplaintService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/complaints")
@Tag(name = "Complaints", description = "User complaint management and analytics")
@RequiredArgsConstructor
@Validated
public class ComplaintController {

    private final ComplaintService complaintService;

    @GetMapping
    @Operation(summary = "List complaints", description = "Optional status, priority and creation-window filters")
    public ResponseEntity<ComplaintListResponse> list(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String priority,
            @RequestParam(required = false) @Min(1) @Max(365) Integer days) {
        ComplaintStatus statusFilter = status != null ? ComplaintStatus.fromValue(status) : null;
        ComplaintPriority priorityFilter = priority != null ? ComplaintPriority.fromValue(priority) : null;
        return ResponseEntity.ok(ComplaintListResponse.of(complaintService.list(statusFilter, priorityFilter, days)));
    }

    @PostMapping
    @Operation(summary = "Create a complaint")
    public ResponseEntity<Complaint> create(@Valid @RequestBody ComplaintRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(complaintService.create(request));
    }

    @GetMapping("/analytics")
    @Operation(summary = "Complaint counts and resolution-time statistics")
    public ResponseEntity<ComplaintAnalytics> analytics(@RequestParam(defaultValue = "30") @Min(1) @Max(365) int days) {
        return ResponseEntity.ok(complaintService.analytics(days));
    }

    @GetMapping("/{complaintId}")
    @Operation(summary = "Complaint detail with audit trail")
    public ResponseEntity<Complaint> get(@PathVariable String complaintId) {
        return ResponseEntity.ok(complaintService.get(complaintId));
    }

    @PutMapping("/{complaintId}")
    @Operation(summary = "Update status, priority, assignment or resolution")
    public ResponseEntity<Complaint> update(@PathVariable String complaintId,
                                            @Valid @RequestBody ComplaintUpdateRequest request) {
        return ResponseEntity.ok(complaintService.update(complaintId, request));
    }
}
