package com.company.pmm.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One timestamped observation of a metric. Immutable once appended.
 */
@Value
@Builder
public class MetricPoint {
    String metricName;
    double value;
    Instant timestamp;
}
