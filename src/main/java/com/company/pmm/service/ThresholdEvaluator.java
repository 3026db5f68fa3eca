package com.company.pmm.service;

import com.company.pmm.domain.Alert;
import com.company.pmm.domain.MetricBand;
import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.enums.Severity;
import com.company.pmm.util.IdGenerator;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Checks one point against its band. Tiers are evaluated most severe first and the
 * first breached tier decides the severity. No deduplication happens here.
 */
@Component
public class ThresholdEvaluator {

    static final String ALERT_TYPE = "threshold_breach";

    private static final List<Tier> TIERS = List.of(
            new Tier(MetricBand::getCriticalThreshold, Severity.CRITICAL),
            new Tier(MetricBand::getAlertThreshold, Severity.HIGH)
    );

    private final Clock clock;
    private final IdGenerator idGenerator = new IdGenerator("ALT", "yyyyMMddHHmmss");

    public ThresholdEvaluator(Clock clock) {
        this.clock = clock;
    }

    public Optional<Alert> evaluate(MetricPoint point, MetricBand band) {
        if (band == null) {
            return Optional.empty();
        }

        for (Tier tier : TIERS) {
            Double threshold = tier.getThreshold().apply(band);
            if (threshold != null && band.getDirection().breaches(point.getValue(), threshold)) {
                return Optional.of(Alert.builder()
                        .alertId(idGenerator.next(clock.instant()))
                        .timestamp(clock.instant())
                        .severity(tier.getSeverity())
                        .alertType(ALERT_TYPE)
                        .metricName(point.getMetricName())
                        .currentValue(point.getValue())
                        .threshold(threshold)
                        .build());
            }
        }
        return Optional.empty();
    }

    @Value
    private static class Tier {
        Function<MetricBand, Double> threshold;
        Severity severity;
    }
}
