package com.company.pmm.service;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.enums.TrendDirection;
import com.company.pmm.dto.response.TrendAnalysis;
import com.company.pmm.util.SeriesStatistics;
import com.company.pmm.util.SeriesStatistics.HalfSplit;
import com.company.pmm.util.SeriesStatistics.LinearFit;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Descriptive statistics, trend classification and a linear short-horizon forecast
 * over a metric window. Uses the same half-split and sample deviation as detection.
 */
@Component
public class TrendAnalyzer {

    private static final int MIN_FORECAST_POINTS = 3;

    // Pseudo-count: confidence reaches 0.5 at this many points for a perfect fit
    private static final double SAMPLE_SATURATION = 5.0;

    private final double stableThreshold;

    public TrendAnalyzer(MonitoringProperties properties) {
        this.stableThreshold = properties.getDetection().getTrendChangeThreshold();
    }

    public Optional<TrendAnalysis> analyze(String metricName, List<MetricPoint> window) {
        if (window.isEmpty()) {
            return Optional.empty();
        }

        double[] values = SeriesStatistics.values(window);
        Optional<HalfSplit> split = SeriesStatistics.halfSplit(values);
        double pct = split.map(HalfSplit::pctChange).orElse(0.0);

        TrendDirection direction = Math.abs(pct) <= stableThreshold
                ? TrendDirection.STABLE
                : TrendDirection.ofChange(pct);

        return Optional.of(TrendAnalysis.builder()
                .metricName(metricName)
                .currentValue(values[values.length - 1])
                .mean(SeriesStatistics.mean(values))
                .std(SeriesStatistics.sampleStdDev(values))
                .min(SeriesStatistics.min(values))
                .max(SeriesStatistics.max(values))
                .trendDirection(direction)
                .trendStrength(Math.min(1.0, Math.abs(pct)))
                .dataPoints(values.length)
                .forecast(forecast(values))
                .build());
    }

    /**
     * Projects the least-squares line one and three steps past the last index.
     * Confidence grows with the number of points and shrinks with the residual
     * spread relative to the series level; it always stays in [0, 1].
     */
    TrendAnalysis.Forecast forecast(double[] values) {
        int n = values.length;
        if (n < MIN_FORECAST_POINTS) {
            return null;
        }

        LinearFit fit = SeriesStatistics.linearFit(values);
        double sampleFactor = n / (n + SAMPLE_SATURATION);
        double relativeNoise = Math.sqrt(fit.getResidualVariance()) / Math.max(Math.abs(fit.getMeanValue()), 1e-9);
        double confidence = sampleFactor / (1.0 + relativeNoise);

        return new TrendAnalysis.Forecast(
                fit.valueAt(n),
                fit.valueAt(n + 2),
                Math.max(0.0, Math.min(1.0, confidence)));
    }
}
