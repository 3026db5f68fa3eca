package com.company.pmm.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertStatus {
    ACTIVE("Threshold condition currently holds"),
    ACKNOWLEDGED("Seen by an operator, condition still holds"),
    RESOLVED("Condition cleared or resolved explicitly");

    private final String description;

    AlertStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    /**
     * Acknowledged alerts stay in the active set until the condition clears.
     */
    public boolean isOpen() {
        return this != RESOLVED;
    }
}
