package com.company.pmm.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentMetric {
    private double currentValue;
    private Instant lastUpdated;
    private double recentAverage;
    private int samples;
}
