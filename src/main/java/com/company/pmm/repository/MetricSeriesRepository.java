package com.company.pmm.repository;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.MetricPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * MetricSeries store: one bounded, time-ordered buffer per metric name.
 * Locking is per series, so appends to different metrics never contend.
 */
@Repository
@Slf4j
public class MetricSeriesRepository {

    private final ConcurrentMap<String, TimeOrderedBuffer<MetricPoint>> series = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;
    private final int maxPointsPerSeries;

    public MetricSeriesRepository(MonitoringProperties properties, Clock clock) {
        this.clock = clock;
        this.retention = properties.getRetention().getMetricWindow();
        this.maxPointsPerSeries = properties.getRetention().getMaxPointsPerSeries();
    }

    public MetricPoint append(String metricName, double value, Instant timestamp) {
        MetricPoint point = MetricPoint.builder()
                .metricName(metricName)
                .value(value)
                .timestamp(timestamp)
                .build();

        series.computeIfAbsent(metricName, this::newSeries).append(point, clock.instant());
        return point;
    }

    /**
     * Points within [now - duration, now], oldest first. Unknown metrics yield an empty list.
     */
    public List<MetricPoint> window(String metricName, Duration duration) {
        Instant now = clock.instant();
        return window(metricName, now.minus(duration), now);
    }

    public List<MetricPoint> window(String metricName, Instant from, Instant to) {
        TimeOrderedBuffer<MetricPoint> buffer = series.get(metricName);
        if (buffer == null) {
            return Collections.emptyList();
        }
        return buffer.between(from, to);
    }

    /**
     * Everything currently retained for the metric.
     */
    public List<MetricPoint> all(String metricName) {
        TimeOrderedBuffer<MetricPoint> buffer = series.get(metricName);
        return buffer == null ? Collections.emptyList() : buffer.snapshot();
    }

    public Optional<MetricPoint> latest(String metricName) {
        TimeOrderedBuffer<MetricPoint> buffer = series.get(metricName);
        return buffer == null ? Optional.empty() : buffer.latest();
    }

    public Set<String> metricNames() {
        return new TreeSet<>(series.keySet());
    }

    public int metricCount() {
        return series.size();
    }

    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (TimeOrderedBuffer<MetricPoint> buffer : series.values()) {
            removed += buffer.evictExpired(now);
        }
        if (removed > 0) {
            log.debug("Evicted {} expired metric points", removed);
        }
        return removed;
    }

    private TimeOrderedBuffer<MetricPoint> newSeries(String metricName) {
        log.info("Tracking new metric series {}", metricName);
        return new TimeOrderedBuffer<>(MetricPoint::getTimestamp, retention, maxPointsPerSeries);
    }
}
