package com.company.pmm.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSnapshotRequest {
    private Instant timestamp;

    @NotNull
    @PositiveOrZero
    private Double responseTimeAvg;

    @NotNull
    @PositiveOrZero
    private Double responseTimeP95;

    @NotNull
    @PositiveOrZero
    private Double throughput;

    @NotNull
    @PositiveOrZero
    private Double errorRate;

    @NotNull
    @PositiveOrZero
    private Double availability;

    @PositiveOrZero
    private int activeUsers;

    @Builder.Default
    private Map<String, Double> system = new HashMap<>();
}
