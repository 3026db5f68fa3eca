package com.company.pmm.detection;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.enums.Severity;
import com.company.pmm.domain.enums.SignalType;
import com.company.pmm.domain.enums.TrendDirection;
import com.company.pmm.util.SeriesStatistics;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relative change between the means of the earlier and later halves of the window.
 */
@Component
@Order(2)
public class TrendChangeRule implements SignalRule {

    private final MonitoringProperties.Detection detection;

    public TrendChangeRule(MonitoringProperties properties) {
        this.detection = properties.getDetection();
    }

    @Override
    public SignalType type() {
        return SignalType.TREND_CHANGE;
    }

    @Override
    public Optional<SignalCandidate> evaluate(String metricName, List<MetricPoint> window) {
        Optional<SeriesStatistics.HalfSplit> split = SeriesStatistics.halfSplit(SeriesStatistics.values(window));
        if (split.isEmpty()) {
            return Optional.empty();
        }

        double pct = split.get().pctChange();
        if (Math.abs(pct) <= detection.getTrendChangeThreshold()) {
            return Optional.empty();
        }

        String direction = pct > 0 ? TrendDirection.INCREASING.getValue() : TrendDirection.DECREASING.getValue();

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("direction", direction);
        context.put("earlier_mean", SeriesStatistics.round(split.get().getEarlierMean(), 6));
        context.put("later_mean", SeriesStatistics.round(split.get().getLaterMean(), 6));
        context.put("window_size", window.size());

        return Optional.of(SignalCandidate.builder()
                .type(SignalType.TREND_CHANGE)
                .severity(Severity.MEDIUM)
                .metricName(metricName)
                .detectedValue(split.get().getLaterMean())
                .expectedValue(split.get().getEarlierMean())
                .deviationPct(pct * 100.0)
                .confidence(Math.min(1.0, Math.abs(pct) / 0.5))
                .description(String.format("Significant %s trend in %s: %.1f%% change",
                        direction, metricName, Math.abs(pct) * 100.0))
                .context(context)
                .build());
    }
}
