package com.company.pmm.service;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.Alert;
import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.enums.AlertStatus;
import com.company.pmm.domain.enums.Severity;
import com.company.pmm.event.AlertRaisedEvent;
import com.company.pmm.exception.AlertNotFoundException;
import com.company.pmm.exception.InvalidStatusTransitionException;
import com.company.pmm.repository.AlertRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Alert lifecycle: raising from band evaluation with per-metric deduplication,
 * clearing when the condition goes away, and operator acknowledge / resolve.
 */
@Service
@Slf4j
public class AlertService {

    static final String SYSTEM_ACTOR = "system";

    private final AlertRepository alertRepository;
    private final ThresholdEvaluator thresholdEvaluator;
    private final MonitoringProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // Serializes the check-then-act of raise/clear per metric
    private final ConcurrentMap<String, Object> metricLocks = new ConcurrentHashMap<>();

    public AlertService(AlertRepository alertRepository,
                        ThresholdEvaluator thresholdEvaluator,
                        MonitoringProperties properties,
                        ApplicationEventPublisher eventPublisher,
                        MeterRegistry meterRegistry,
                        Clock clock) {
        this.alertRepository = alertRepository;
        this.thresholdEvaluator = thresholdEvaluator;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Evaluates a freshly appended point against its band.
     *
     * @return the newly raised alert, empty when nothing new was raised
     */
    public Optional<Alert> evaluate(MetricPoint point) {
        return properties.bandFor(point.getMetricName())
                .flatMap(band -> {
                    Optional<Alert> breach = thresholdEvaluator.evaluate(point, band);
                    synchronized (lockFor(point.getMetricName())) {
                        if (breach.isEmpty()) {
                            clear(point.getMetricName());
                            return Optional.empty();
                        }
                        return raise(breach.get());
                    }
                });
    }

    public List<Alert> getActiveAlerts() {
        return alertRepository.findOpen();
    }

    public List<Alert> getAlertsSince(Instant since) {
        return alertRepository.findSince(since);
    }

    public Alert getAlert(String alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    public Alert acknowledge(String alertId, String actor) {
        requireActor(actor);
        Instant now = clock.instant();
        Alert updated = alertRepository.update(alertId, current -> {
            if (!current.isOpen()) {
                throw new InvalidStatusTransitionException(alertId, current.getStatus().getValue(), AlertStatus.ACKNOWLEDGED.getValue());
            }
            return current.toBuilder()
                    .status(AlertStatus.ACKNOWLEDGED)
                    .acknowledgedBy(actor)
                    .acknowledgedAt(now)
                    .build();
        }).orElseThrow(() -> new AlertNotFoundException(alertId));

        log.info("Alert {} acknowledged by {}", alertId, actor);
        return updated;
    }

    public Alert resolve(String alertId, String actor) {
        requireActor(actor);
        Alert updated = alertRepository.update(alertId, current -> {
            if (!current.isOpen()) {
                throw new InvalidStatusTransitionException(alertId, current.getStatus().getValue(), AlertStatus.RESOLVED.getValue());
            }
            return resolved(current, actor, clock.instant());
        }).orElseThrow(() -> new AlertNotFoundException(alertId));

        log.info("Alert {} resolved by {}", alertId, actor);
        return updated;
    }

    private Optional<Alert> raise(Alert candidate) {
        String metricName = candidate.getMetricName();

        if (properties.getAlerts().isDeduplicate()) {
            for (Alert open : alertRepository.findOpenByMetric(metricName)) {
                if (open.getSeverity().isAtLeast(candidate.getSeverity())) {
                    alertRepository.update(open.getAlertId(),
                            current -> current.toBuilder().currentValue(candidate.getCurrentValue()).build());
                    log.debug("Alert {} still open for {}, refreshed value to {}",
                            open.getAlertId(), metricName, candidate.getCurrentValue());
                    return Optional.empty();
                }
                // Escalation: the less severe alert is superseded
                alertRepository.update(open.getAlertId(), current -> resolved(current, SYSTEM_ACTOR, clock.instant()));
                log.info("Alert {} superseded by {} breach on {}",
                        open.getAlertId(), candidate.getSeverity().getValue(), metricName);
            }
        }

        alertRepository.save(candidate);

        if (candidate.getSeverity() == Severity.CRITICAL) {
            log.warn("CRITICAL alert {}: {} = {} breached {}",
                    candidate.getAlertId(), metricName, candidate.getCurrentValue(), candidate.getThreshold());
        } else {
            log.info("Alert {} raised: {} = {} breached {} ({})",
                    candidate.getAlertId(), metricName, candidate.getCurrentValue(),
                    candidate.getThreshold(), candidate.getSeverity().getValue());
        }

        meterRegistry.counter("pmm.alerts.raised",
                "metric", metricName,
                "severity", candidate.getSeverity().getValue()
        ).increment();

        eventPublisher.publishEvent(new AlertRaisedEvent(candidate));
        return Optional.of(candidate);
    }

    private void clear(String metricName) {
        Instant now = clock.instant();
        for (Alert open : alertRepository.findOpenByMetric(metricName)) {
            alertRepository.update(open.getAlertId(), current ->
                    current.isOpen() ? resolved(current, SYSTEM_ACTOR, now) : current);
            log.info("Alert {} cleared: {} back within band", open.getAlertId(), metricName);
            meterRegistry.counter("pmm.alerts.cleared", "metric", metricName).increment();
        }
    }

    private static Alert resolved(Alert alert, String actor, Instant at) {
        return alert.toBuilder()
                .status(AlertStatus.RESOLVED)
                .resolvedBy(actor)
                .resolvedAt(at)
                .build();
    }

    private Object lockFor(String metricName) {
        return metricLocks.computeIfAbsent(metricName, k -> new Object());
    }

    private static void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Actor identity is required");
        }
    }
}
