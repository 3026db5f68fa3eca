package com.company.pmm.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tracked performance dimensions with the comparison their target uses.
 */
public enum SlaDimension {
    RESPONSE_TIME_AVG("response_time_avg", Comparison.BELOW),
    RESPONSE_TIME_P95("response_time_p95", Comparison.BELOW),
    AVAILABILITY("availability", Comparison.AT_LEAST),
    ERROR_RATE("error_rate", Comparison.AT_MOST),
    THROUGHPUT("throughput", Comparison.AT_LEAST);

    public enum Comparison {
        BELOW {
            @Override
            public boolean satisfied(double actual, double target) {
                return actual < target;
            }
        },
        AT_MOST {
            @Override
            public boolean satisfied(double actual, double target) {
                return actual <= target;
            }
        },
        AT_LEAST {
            @Override
            public boolean satisfied(double actual, double target) {
                return actual >= target;
            }
        };

        public abstract boolean satisfied(double actual, double target);
    }

    private final String key;
    private final Comparison comparison;

    SlaDimension(String key, Comparison comparison) {
        this.key = key;
        this.comparison = comparison;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public Comparison getComparison() {
        return comparison;
    }

    public boolean isCompliant(double actual, double target) {
        return comparison.satisfied(actual, target);
    }
}
