package com.company.pmm.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
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
public class KpiSummary {
    private Instant timestamp;
    private Interactions interactions;
    private Feedback feedback;
    private Map<String, Double> metrics;
    private Alerts alerts;
    private Signals signals;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Interactions {
        @JsonProperty("last_24h")
        private long last24h;
        @JsonProperty("last_7d")
        private long last7d;
        private double avgPerDay;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Feedback {
        @JsonProperty("count_7d")
        private long count7d;
        private double avgRating;
        private double satisfactionRate;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Alerts {
        private long active;
        @JsonProperty("last_24h")
        private long last24h;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Signals {
        private long active;
        @JsonProperty("detected_7d")
        private long detected7d;
    }
}
