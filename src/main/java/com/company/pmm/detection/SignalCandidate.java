package com.company.pmm.detection;

import com.company.pmm.domain.enums.Severity;
import com.company.pmm.domain.enums.SignalType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Rule output before an id and timestamp are assigned.
 */
@Value
@Builder
public class SignalCandidate {
    SignalType type;
    Severity severity;
    String metricName;
    double detectedValue;
    double expectedValue;
    double deviationPct;
    double confidence;
    String description;
    Map<String, Object> context;
}
