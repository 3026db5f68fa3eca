package com.company.pmm.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Latest performance snapshot with an ok/breach verdict per SLA dimension.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimePerformance {
    private Instant timestamp;
    private Map<String, DimensionReading> dimensions;
    private int activeUsers;
    private Map<String, Double> system;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DimensionReading {
        private double value;
        private double target;
        private String slaStatus;
    }
}
