package com.company.pmm.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplaintAnalytics {
    private int periodDays;
    private long total;
    private Map<String, Long> byStatus;
    private Map<String, Long> byPriority;
    private Map<String, Long> byCategory;
    private ResolutionStats resolutionStats;
    private long openCount;

    /**
     * Averages are null when nothing was resolved in the period.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResolutionStats {
        private long resolvedCount;
        private Double avgResolutionHours;
        private Double minResolutionHours;
        private Double maxResolutionHours;
        private String avgResolutionTime;
    }
}
