package com.company.pmm.controller;

import com.company.pmm.domain.RegulatoryReport;
import com.company.pmm.domain.enums.ReportStatus;
import com.company.pmm.domain.enums.ReportType;
import com.company.pmm.dto.request.ReportGenerateRequest;
import com.company.pmm.dto.response.ComplianceStatus;
import com.company.pmm.dto.response.ReportListResponse;
import com.company.pmm.service.RegulatoryReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/regulatory")
@Tag(name = "Regulatory", description = "EU AI Act Article 72 compliance and reports")
@RequiredArgsConstructor
public class RegulatoryController {

    private final RegulatoryReportService reportService;

    @GetMapping("/compliance-status")
    @Operation(summary = "Article 72 requirement checklist")
    public ResponseEntity<ComplianceStatus> getComplianceStatus() {
        return ResponseEntity.ok(reportService.getComplianceStatus());
    }

    @PostMapping("/reports/generate")
    @Operation(summary = "Generate a draft report", description = "Builds the report content; document rendering is done downstream")
    public ResponseEntity<RegulatoryReport> generate(@Valid @RequestBody(required = false) ReportGenerateRequest request) {
        ReportGenerateRequest effective = request != null ? request : ReportGenerateRequest.builder().build();
        RegulatoryReport report = reportService.generate(
                ReportType.fromValue(effective.getReportType()), effective.getPeriodDays());
        return ResponseEntity.status(HttpStatus.CREATED).body(report);
    }

    @GetMapping("/reports")
    @Operation(summary = "List reports", description = "Optional type and status filters")
    public ResponseEntity<ReportListResponse> list(
            @RequestParam(value = "report_type", required = false) String reportType,
            @RequestParam(required = false) String status) {
        ReportType typeFilter = reportType != null ? ReportType.fromValue(reportType) : null;
        ReportStatus statusFilter = status != null ? ReportStatus.fromValue(status) : null;
        return ResponseEntity.ok(ReportListResponse.of(reportService.list(typeFilter, statusFilter)));
    }

    @GetMapping("/reports/{reportId}")
    @Operation(summary = "Report detail")
    public ResponseEntity<RegulatoryReport> get(@PathVariable String reportId) {
        return ResponseEntity.ok(reportService.get(reportId));
    }
}
