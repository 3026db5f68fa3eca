package com.company.pmm.domain;

import com.company.pmm.domain.enums.SlaDimension;
import com.fasterxml.jackson.annotation.JsonIgnore;
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
public class PerformanceSnapshot {
    private Instant timestamp;
    private double responseTimeAvg;   // ms
    private double responseTimeP95;   // ms
    private double throughput;        // requests/sec
    private double errorRate;         // %
    private double availability;      // %
    private int activeUsers;

    // cpu_usage, memory_usage, request_queue, ...
    private Map<String, Double> system;

    @JsonIgnore
    public double valueOf(SlaDimension dimension) {
        switch (dimension) {
            case RESPONSE_TIME_AVG:
                return responseTimeAvg;
            case RESPONSE_TIME_P95:
                return responseTimeP95;
            case AVAILABILITY:
                return availability;
            case ERROR_RATE:
                return errorRate;
            case THROUGHPUT:
                return throughput;
            default:
                throw new IllegalArgumentException("Unknown SLA dimension: " + dimension);
        }
    }
}
