package com.company.pmm.service;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.PerformanceSnapshot;
import com.company.pmm.domain.enums.SlaDimension;
import com.company.pmm.domain.enums.SlaStatus;
import com.company.pmm.dto.response.SlaStatusResponse;
import com.company.pmm.util.SeriesStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compares period averages of the performance snapshots against the SLA targets.
 */
@Service
@Slf4j
public class SlaEvaluationService {

    private final MonitoringProperties.Sla sla;

    public SlaEvaluationService(MonitoringProperties properties) {
        this.sla = properties.getSla();
    }

    public SlaStatusResponse evaluate(List<PerformanceSnapshot> snapshots, Duration period) {
        double periodHours = period.toMinutes() / 60.0;
        if (snapshots.isEmpty()) {
            return SlaStatusResponse.builder()
                    .status(SlaStatus.NO_DATA)
                    .periodHours(periodHours)
                    .metrics(Map.of())
                    .breaches(List.of())
                    .samples(0)
                    .build();
        }

        Map<String, SlaStatusResponse.DimensionResult> metrics = new LinkedHashMap<>();
        List<SlaStatusResponse.Breach> breaches = new ArrayList<>();

        for (SlaDimension dimension : SlaDimension.values()) {
            double actual = snapshots.stream().mapToDouble(s -> s.valueOf(dimension)).average().orElse(0.0);
            double target = sla.targetFor(dimension);
            boolean compliant = dimension.isCompliant(actual, target);

            metrics.put(dimension.getKey(),
                    new SlaStatusResponse.DimensionResult(SeriesStatistics.round(actual, 3), target, compliant));
            if (!compliant) {
                breaches.add(new SlaStatusResponse.Breach(dimension.getKey(), SeriesStatistics.round(actual, 3), target));
            }
        }

        SlaStatus status = breaches.isEmpty() ? SlaStatus.COMPLIANT : SlaStatus.BREACH;
        if (status == SlaStatus.BREACH) {
            log.warn("SLA breach over the last {}h: {}", periodHours,
                    breaches.stream().map(SlaStatusResponse.Breach::getDimension).collect(Collectors.toList()));
        }

        return SlaStatusResponse.builder()
                .status(status)
                .periodHours(periodHours)
                .metrics(metrics)
                .breaches(breaches)
                .samples(snapshots.size())
                .build();
    }

    public boolean isCompliant(SlaDimension dimension, double actual) {
        return dimension.isCompliant(actual, sla.targetFor(dimension));
    }

    public double targetFor(SlaDimension dimension) {
        return sla.targetFor(dimension);
    }
}
