package com.company.pmm.support;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.MetricBand;
import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.enums.MetricDirection;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class TestFixtures {

    public static final Instant NOW = Instant.parse("2025-03-15T12:00:00Z");

    private TestFixtures() {
    }

    /**
     * Defaults plus the response_accuracy and hallucination_rate bands.
     */
    public static MonitoringProperties properties() {
        MonitoringProperties properties = new MonitoringProperties();
        properties.getBands().put("response_accuracy", MetricBand.builder()
                .target(0.95).alertThreshold(0.90).criticalThreshold(0.85)
                .direction(MetricDirection.HIGHER_IS_BETTER)
                .build());
        properties.getBands().put("hallucination_rate", MetricBand.builder()
                .target(0.02).alertThreshold(0.05).criticalThreshold(0.10)
                .direction(MetricDirection.LOWER_IS_BETTER)
                .build());
        return properties;
    }

    /**
     * One point per minute, the last one at {@link #NOW}.
     */
    public static List<MetricPoint> series(String metricName, double... values) {
        List<MetricPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(MetricPoint.builder()
                    .metricName(metricName)
                    .value(values[i])
                    .timestamp(NOW.minus(Duration.ofMinutes(values.length - 1 - i)))
                    .build());
        }
        return points;
    }
}
