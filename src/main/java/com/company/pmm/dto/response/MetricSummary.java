package com.company.pmm.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate of one metric over a period, values rounded to 4 places.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSummary {
    private int count;
    private double avg;
    private double min;
    private double max;
    private double std;
    private double latest;
}
