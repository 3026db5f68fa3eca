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
 * Sustained decline: a run of consecutive strictly decreasing points.
 * The longest run wins; among equally long runs the most recent one is reported.
 */
@Component
@Order(3)
public class DeclinePatternRule implements SignalRule {

    private final MonitoringProperties.Detection detection;

    public DeclinePatternRule(MonitoringProperties properties) {
        this.detection = properties.getDetection();
    }

    @Override
    public SignalType type() {
        return SignalType.PATTERN_DETECTED;
    }

    @Override
    public Optional<SignalCandidate> evaluate(String metricName, List<MetricPoint> window) {
        int minRun = detection.getMinDeclineRun();
        double[] values = SeriesStatistics.values(window);
        if (values.length < minRun) {
            return Optional.empty();
        }

        int bestStart = 0;
        int bestLength = 1;
        int runStart = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] >= values[i - 1]) {
                runStart = i;
            }
            int runLength = i - runStart + 1;
            if (runLength >= bestLength) {
                bestLength = runLength;
                bestStart = runStart;
            }
        }

        if (bestLength < minRun) {
            return Optional.empty();
        }

        double start = values[bestStart];
        double end = values[bestStart + bestLength - 1];
        double deviationPct = start == 0.0 ? 0.0 : (end - start) / start * 100.0;

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("pattern", "consecutive_decline");
        context.put("run_length", bestLength);
        context.put("run_started_at", window.get(bestStart).getTimestamp().toString());

        return Optional.of(SignalCandidate.builder()
                .type(SignalType.PATTERN_DETECTED)
                .severity(Severity.MEDIUM)
                .metricName(metricName)
                .detectedValue(end)
                .expectedValue(start)
                .deviationPct(deviationPct)
                .confidence(Math.min(1.0, 0.8 + 0.05 * (bestLength - minRun)))
                .description(String.format("Consecutive decline in %s over %d data points (%.4f -> %.4f)",
                        metricName, bestLength, start, end))
                .context(context)
                .build());
    }
}
