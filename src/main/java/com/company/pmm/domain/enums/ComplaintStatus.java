package com.company.pmm.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ComplaintStatus {
    OPEN,
    IN_PROGRESS,
    UNDER_REVIEW,
    RESOLVED,
    CLOSED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    /**
     * resolved_at is set exactly when this returns true.
     */
    public boolean isTerminal() {
        return this == RESOLVED || this == CLOSED;
    }

    @JsonCreator
    public static ComplaintStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Complaint status is required");
        }
        try {
            return ComplaintStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown complaint status: " + value);
        }
    }
}
