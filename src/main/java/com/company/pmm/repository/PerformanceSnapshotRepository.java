package com.company.pmm.repository;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.PerformanceSnapshot;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class PerformanceSnapshotRepository {

    private final TimeOrderedBuffer<PerformanceSnapshot> snapshots;
    private final Clock clock;

    public PerformanceSnapshotRepository(MonitoringProperties properties, Clock clock) {
        this.clock = clock;
        this.snapshots = new TimeOrderedBuffer<>(
                PerformanceSnapshot::getTimestamp,
                properties.getRetention().getPerformanceWindow(),
                properties.getRetention().getMaxSnapshots());
    }

    public PerformanceSnapshot save(PerformanceSnapshot snapshot) {
        snapshots.append(snapshot, clock.instant());
        return snapshot;
    }

    public List<PerformanceSnapshot> findSince(Duration period) {
        Instant now = clock.instant();
        return snapshots.between(now.minus(period), now);
    }

    public Optional<PerformanceSnapshot> findLatest() {
        return snapshots.latest();
    }

    public int evictExpired() {
        return snapshots.evictExpired(clock.instant());
    }
}
