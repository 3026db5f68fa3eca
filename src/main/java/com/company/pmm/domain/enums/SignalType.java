package com.company.pmm.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalType {
    ANOMALY,
    TREND_CHANGE,
    PATTERN_DETECTED,
    THRESHOLD_BREACH,
    DRIFT_DETECTED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
