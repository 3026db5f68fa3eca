package com.company.pmm.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReportStatus {
    DRAFT,
    PENDING_REVIEW,
    APPROVED,
    SUBMITTED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    public static ReportStatus fromValue(String value) {
        try {
            return ReportStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report status: " + value);
        }
    }
}
