package com.company.pmm.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * EU AI Act Article 72 requirement checklist.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceStatus {
    private String framework;
    private List<String> articlesCovered;
    private String overallStatus;
    private Map<String, Requirement> articles;
    private Instant lastUpdated;
    private Instant nextAuditDue;
    private String systemClassification;
    private String monitoringStatus;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Requirement {
        private String requirement;
        private String status;
        private Instant lastVerified;
    }
}
