package com.company.pmm.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health status bands. Breakpoints are policy constants: a score maps to the
 * first band (in declaration order) whose minimum it reaches.
 */
public enum HealthStatus {
    HEALTHY(90),
    WARNING(70),
    DEGRADED(50),
    CRITICAL(0);

    private final int minScore;

    HealthStatus(int minScore) {
        this.minScore = minScore;
    }

    public int getMinScore() {
        return minScore;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    public static HealthStatus fromScore(int score) {
        for (HealthStatus status : values()) {
            if (score >= status.minScore) {
                return status;
            }
        }
        return CRITICAL;
    }
}
