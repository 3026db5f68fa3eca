package com.company.pmm.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ComplaintPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ComplaintPriority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return ComplaintPriority.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown complaint priority: " + value);
        }
    }
}
