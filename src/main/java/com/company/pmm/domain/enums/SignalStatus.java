package com.company.pmm.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED,
    FALSE_POSITIVE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    public boolean isFinal() {
        return this == RESOLVED || this == FALSE_POSITIVE;
    }

    /**
     * Strict parse for user input: unknown values are rejected rather than defaulted.
     */
    @JsonCreator
    public static SignalStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Signal status is required");
        }
        try {
            return SignalStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown signal status: " + value);
        }
    }
}
