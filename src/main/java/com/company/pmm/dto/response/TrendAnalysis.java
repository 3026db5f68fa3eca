package com.company.pmm.dto.response;

import com.company.pmm.domain.enums.TrendDirection;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Derived view over a metric window. Never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendAnalysis {
    private String metricName;
    private double currentValue;
    private double mean;
    private double std;
    private double min;
    private double max;
    private TrendDirection trendDirection;
    private double trendStrength;
    private int dataPoints;

    // Null when the window has fewer than three points
    private Forecast forecast;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Forecast {
        private double nextValue;
        @JsonProperty("next_3")
        private double next3;
        private double confidence;
    }
}
