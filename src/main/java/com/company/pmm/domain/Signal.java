package com.company.pmm.domain;

import com.company.pmm.domain.enums.Severity;
import com.company.pmm.domain.enums.SignalStatus;
import com.company.pmm.domain.enums.SignalType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Automatically detected statistical event about a metric.
 * Status only changes through explicit acknowledge / resolve operations.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Signal {
    String signalId;
    Instant timestamp;

    @JsonProperty("type")
    SignalType signalType;

    Severity severity;
    String metricName;
    double detectedValue;
    double expectedValue;
    double deviationPct;
    double confidence;
    String description;

    @Builder.Default
    SignalStatus status = SignalStatus.ACTIVE;

    String acknowledgedBy;
    Instant acknowledgedAt;
    String resolvedBy;
    Instant resolvedAt;

    @Builder.Default
    Map<String, Object> context = Map.of();

    @JsonIgnore
    public boolean isOpen() {
        return status != null && !status.isFinal();
    }
}
