package com.company.pmm.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which side of a threshold counts as a breach.
 */
public enum MetricDirection {
    HIGHER_IS_BETTER("higher-is-better") {
        @Override
        public boolean breaches(double value, double threshold) {
            return value < threshold;
        }
    },
    LOWER_IS_BETTER("lower-is-better") {
        @Override
        public boolean breaches(double value, double threshold) {
            return value > threshold;
        }
    };

    private final String value;

    MetricDirection(String value) {
        this.value = value;
    }

    public abstract boolean breaches(double value, double threshold);

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MetricDirection fromValue(String value) {
        for (MetricDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value) || direction.name().equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown metric direction: " + value);
    }
}
