package com.company.pmm.detection;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.enums.Severity;
import com.company.pmm.domain.enums.SignalType;
import com.company.pmm.util.SeriesStatistics;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Z-score of the latest point against the points before it.
 */
@Component
@Order(1)
public class AnomalyRule implements SignalRule {

    private static final int MIN_POINTS = 3;

    private final MonitoringProperties.Detection detection;

    public AnomalyRule(MonitoringProperties properties) {
        this.detection = properties.getDetection();
    }

    @Override
    public SignalType type() {
        return SignalType.ANOMALY;
    }

    @Override
    public Optional<SignalCandidate> evaluate(String metricName, List<MetricPoint> window) {
        if (window.size() < MIN_POINTS) {
            return Optional.empty();
        }

        double[] values = SeriesStatistics.values(window);
        int last = values.length - 1;
        double latest = values[last];
        double mean = SeriesStatistics.mean(values, 0, last);
        double std = SeriesStatistics.sampleStdDev(values, 0, last);

        // A flat baseline gives no scale to measure against
        if (std == 0.0) {
            return Optional.empty();
        }

        double z = Math.abs(latest - mean) / std;
        if (z <= detection.getAnomalyZThreshold()) {
            return Optional.empty();
        }

        Severity severity = z > detection.getHighSeverityZThreshold() ? Severity.HIGH : Severity.MEDIUM;
        double deviationPct = mean == 0.0 ? 0.0 : (latest - mean) / mean * 100.0;

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("z_score", SeriesStatistics.round(z, 4));
        context.put("baseline_mean", SeriesStatistics.round(mean, 6));
        context.put("baseline_std", SeriesStatistics.round(std, 6));
        context.put("window_size", values.length);

        return Optional.of(SignalCandidate.builder()
                .type(SignalType.ANOMALY)
                .severity(severity)
                .metricName(metricName)
                .detectedValue(latest)
                .expectedValue(mean)
                .deviationPct(deviationPct)
                .confidence(Math.min(1.0, z / 4.0))
                .description(String.format("Anomaly in %s: value %.4f is %.2f standard deviations from mean %.4f",
                        metricName, latest, z, mean))
                .context(context)
                .build());
    }
}
