package com.company.pmm.service;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.PerformanceSnapshot;
import com.company.pmm.domain.enums.SlaDimension;
import com.company.pmm.dto.response.RealtimePerformance;
import com.company.pmm.dto.response.SlaStatusResponse;
import com.company.pmm.repository.PerformanceSnapshotRepository;
import com.company.pmm.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class PerformanceService {

    private final PerformanceSnapshotRepository snapshotRepository;
    private final SlaEvaluationService slaEvaluationService;
    private final MonitoringProperties properties;

    /**
     * Latest snapshot with an ok/breach verdict per dimension; empty before the first snapshot.
     */
    public Optional<RealtimePerformance> getRealtime() {
        return snapshotRepository.findLatest().map(snapshot -> {
            Map<String, RealtimePerformance.DimensionReading> readings = new LinkedHashMap<>();
            for (SlaDimension dimension : SlaDimension.values()) {
                double value = snapshot.valueOf(dimension);
                readings.put(dimension.getKey(), new RealtimePerformance.DimensionReading(
                        value,
                        slaEvaluationService.targetFor(dimension),
                        slaEvaluationService.isCompliant(dimension, value) ? "ok" : "breach"));
            }
            return RealtimePerformance.builder()
                    .timestamp(snapshot.getTimestamp())
                    .dimensions(readings)
                    .activeUsers(snapshot.getActiveUsers())
                    .system(snapshot.getSystem())
                    .build();
        });
    }

    public List<PerformanceSnapshot> getHistory(int hours) {
        return snapshotRepository.findSince(TimeUtils.hours(hours));
    }

    public SlaStatusResponse getSlaStatus(Integer hours) {
        Duration period = hours != null ? TimeUtils.hours(hours) : properties.getSla().getDefaultPeriod();
        return slaEvaluationService.evaluate(snapshotRepository.findSince(period), period);
    }
}
