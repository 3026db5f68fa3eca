package com.company.pmm.domain;

import com.company.pmm.domain.enums.AlertStatus;
import com.company.pmm.domain.enums.Severity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Threshold-crossing notification tied to a metric band.
 * Stored records are replaced on every transition, never mutated in place.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Alert {
    String alertId;
    Instant timestamp;
    Severity severity;
    String alertType;
    String metricName;
    double currentValue;
    double threshold;

    @Builder.Default
    AlertStatus status = AlertStatus.ACTIVE;

    String acknowledgedBy;
    Instant acknowledgedAt;
    String resolvedBy;
    Instant resolvedAt;

    @JsonIgnore
    public boolean isOpen() {
        return status != null && status.isOpen();
    }
}
