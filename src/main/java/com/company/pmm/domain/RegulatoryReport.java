package com.company.pmm.domain;

import com.company.pmm.domain.enums.ReportStatus;
import com.company.pmm.domain.enums.ReportType;
import com.company.pmm.dto.response.ComplianceStatus;
import com.company.pmm.dto.response.IncidentsSummary;
import com.company.pmm.dto.response.MetricSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Article 72 report content. Rendering it into a document is done downstream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegulatoryReport {
    private String reportId;
    private Instant createdAt;
    private ReportType reportType;
    private Instant periodStart;
    private Instant periodEnd;
    private ReportStatus status;
    private String title;
    private String summary;
    private Map<String, MetricSummary> metricsSummary;
    private IncidentsSummary incidentsSummary;
    private Map<String, Object> signalsSummary;
    private ComplianceStatus complianceStatus;
    private List<String> recommendations;
    private Instant submittedAt;
    private String submittedTo;
}
