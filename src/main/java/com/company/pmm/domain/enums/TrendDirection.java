package com.company.pmm.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    INCREASING,
    STABLE,
    DECREASING;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    public static TrendDirection ofChange(double pctChange) {
        return pctChange > 0 ? INCREASING : DECREASING;
    }
}
