package com.company.pmm.service;

import com.company.pmm.domain.MetricPoint;
import com.company.pmm.dto.response.CurrentMetric;
import com.company.pmm.dto.response.MetricSummary;
import com.company.pmm.dto.response.TrendAnalysis;
import com.company.pmm.repository.MetricSeriesRepository;
import com.company.pmm.util.SeriesStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the metric store: current values, period summaries, trends and forecasts.
 * Unknown metrics simply do not appear in the results.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsQueryService {

    static final int RECENT_POINTS = 10;
    private static final int SCALE = 4;

    private final MetricSeriesRepository metricRepository;
    private final TrendAnalyzer trendAnalyzer;
    private final Clock clock;

    public Map<String, CurrentMetric> getCurrentMetrics() {
        Map<String, CurrentMetric> current = new LinkedHashMap<>();
        for (String name : metricRepository.metricNames()) {
            List<MetricPoint> points = metricRepository.all(name);
            if (points.isEmpty()) {
                continue;
            }
            List<MetricPoint> recent = points.subList(Math.max(0, points.size() - RECENT_POINTS), points.size());
            MetricPoint latest = points.get(points.size() - 1);

            current.put(name, CurrentMetric.builder()
                    .currentValue(latest.getValue())
                    .lastUpdated(latest.getTimestamp())
                    .recentAverage(SeriesStatistics.round(SeriesStatistics.mean(SeriesStatistics.values(recent)), SCALE))
                    .samples(recent.size())
                    .build());
        }
        return current;
    }

    /**
     * Per-metric aggregates over [now - period, now], limited to the requested names when given.
     */
    public Map<String, MetricSummary> summarize(Collection<String> metricNames, Duration period) {
        Instant end = clock.instant();
        return summarize(metricNames, end.minus(period), end);
    }

    public Map<String, MetricSummary> summarize(Collection<String> metricNames, Instant from, Instant to) {
        Collection<String> names = metricNames == null || metricNames.isEmpty()
                ? metricRepository.metricNames()
                : metricNames;

        Map<String, MetricSummary> summary = new LinkedHashMap<>();
        for (String name : names) {
            List<MetricPoint> points = metricRepository.window(name, from, to);
            if (!points.isEmpty()) {
                summary.put(name, summarize(points));
            }
        }
        return summary;
    }

    public Map<String, TrendAnalysis> getAllTrends(Duration period) {
        Map<String, TrendAnalysis> trends = new LinkedHashMap<>();
        for (String name : metricRepository.metricNames()) {
            analyze(name, period).ifPresent(trend -> trends.put(name, trend));
        }
        return trends;
    }

    public Optional<TrendAnalysis> analyze(String metricName, Duration period) {
        return trendAnalyzer.analyze(metricName, metricRepository.window(metricName, period));
    }

    public int countTrackedMetrics() {
        return metricRepository.metricCount();
    }

    private static MetricSummary summarize(List<MetricPoint> points) {
        double[] values = SeriesStatistics.values(points);
        return MetricSummary.builder()
                .count(values.length)
                .avg(SeriesStatistics.round(SeriesStatistics.mean(values), SCALE))
                .min(SeriesStatistics.round(SeriesStatistics.min(values), SCALE))
                .max(SeriesStatistics.round(SeriesStatistics.max(values), SCALE))
                .std(SeriesStatistics.round(SeriesStatistics.sampleStdDev(values), SCALE))
                .latest(SeriesStatistics.round(values[values.length - 1], SCALE))
                .build();
    }
}
