package com.company.pmm.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReportType {
    PERIODIC,
    INCIDENT,
    COMPLIANCE,
    AUDIT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ReportType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PERIODIC;
        }
        try {
            return ReportType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report type: " + value);
        }
    }
}
