package com.company.pmm.dto.response;

import com.company.pmm.domain.enums.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardOverview {
    private Instant timestamp;
    private int healthScore;
    private HealthStatus healthStatus;
    private int activeSignals;
    private int activeAlerts;
    private long openComplaints;
    private long feedbackToday;
    private int metricsTracked;
    private Map<String, TrendSummary> trendsSummary;
    private String complianceStatus;
    private String lastReport;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TrendSummary {
        private String direction;
        private double current;
    }
}
