package com.company.pmm.service;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.detection.SignalDetector;
import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.Signal;
import com.company.pmm.domain.enums.Severity;
import com.company.pmm.domain.enums.SignalStatus;
import com.company.pmm.dto.response.DetectionRunResponse;
import com.company.pmm.event.SignalDetectedEvent;
import com.company.pmm.exception.InvalidStatusTransitionException;
import com.company.pmm.exception.SignalNotFoundException;
import com.company.pmm.repository.MetricSeriesRepository;
import com.company.pmm.repository.SignalRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Runs detection passes over the metric store and owns the signal lifecycle.
 */
@Service
@Slf4j
public class SignalService {

    private final MetricSeriesRepository metricRepository;
    private final SignalRepository signalRepository;
    private final SignalDetector detector;
    private final MonitoringProperties.Detection detection;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // Guards the duplicate check and the save that follows it
    private final Object storeLock = new Object();

    public SignalService(MetricSeriesRepository metricRepository,
                         SignalRepository signalRepository,
                         SignalDetector detector,
                         MonitoringProperties properties,
                         ApplicationEventPublisher eventPublisher,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.metricRepository = metricRepository;
        this.signalRepository = signalRepository;
        this.detector = detector;
        this.detection = properties.getDetection();
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Detection pass over every tracked metric.
     */
    public DetectionRunResponse runDetection() {
        Collection<String> metricNames = metricRepository.metricNames();
        List<Signal> signals = detect(metricNames);
        return new DetectionRunResponse(clock.instant(), metricNames.size(), signals.size(), signals);
    }

    /**
     * Detection pass over the given metrics.
     *
     * @return the signals stored by this pass
     */
    public List<Signal> detect(Collection<String> metricNames) {
        Timer.Sample sample = Timer.start(meterRegistry);
        List<Signal> stored = new ArrayList<>();

        for (String metricName : metricNames) {
            List<MetricPoint> window = recentWindow(metricName);
            for (Signal signal : detector.detect(metricName, window)) {
                if (store(signal)) {
                    stored.add(signal);
                }
            }
        }

        sample.stop(meterRegistry.timer("pmm.signals.detection.duration"));
        if (!stored.isEmpty()) {
            log.info("Detection pass over {} metrics produced {} signals", metricNames.size(), stored.size());
        } else {
            log.debug("Detection pass over {} metrics produced no signals", metricNames.size());
        }
        return stored;
    }

    public List<Signal> getActiveSignals() {
        return signalRepository.findByStatus(SignalStatus.ACTIVE);
    }

    public List<Signal> getHistory(SignalStatus status, Duration period) {
        return signalRepository.findSince(clock.instant().minus(period), status);
    }

    public Signal getSignal(String signalId) {
        return signalRepository.findById(signalId)
                .orElseThrow(() -> new SignalNotFoundException(signalId));
    }

    public Signal acknowledge(String signalId, String actor) {
        requireActor(actor);
        Instant now = clock.instant();
        Signal updated = transition(signalId, SignalStatus.ACKNOWLEDGED, current -> current.toBuilder()
                .status(SignalStatus.ACKNOWLEDGED)
                .acknowledgedBy(actor)
                .acknowledgedAt(now)
                .build());
        log.info("Signal {} acknowledged by {}", signalId, actor);
        return updated;
    }

    public Signal resolve(String signalId, String actor) {
        return close(signalId, actor, SignalStatus.RESOLVED);
    }

    public Signal markFalsePositive(String signalId, String actor) {
        return close(signalId, actor, SignalStatus.FALSE_POSITIVE);
    }

    private Signal close(String signalId, String actor, SignalStatus target) {
        requireActor(actor);
        Instant now = clock.instant();
        Signal updated = transition(signalId, target, current -> current.toBuilder()
                .status(target)
                .resolvedBy(actor)
                .resolvedAt(now)
                .build());
        log.info("Signal {} marked {} by {}", signalId, target.getValue(), actor);
        return updated;
    }

    private Signal transition(String signalId, SignalStatus target, UnaryOperator<Signal> change) {
        return signalRepository.update(signalId, current -> {
            if (current.getStatus().isFinal()) {
                throw new InvalidStatusTransitionException(signalId, current.getStatus().getValue(), target.getValue());
            }
            return change.apply(current);
        }).orElseThrow(() -> new SignalNotFoundException(signalId));
    }

    private List<MetricPoint> recentWindow(String metricName) {
        List<MetricPoint> window = metricRepository.window(metricName, detection.getWindow());
        int maxPoints = detection.getMaxPoints();
        if (window.size() > maxPoints) {
            return window.subList(window.size() - maxPoints, window.size());
        }
        return window;
    }

    private boolean store(Signal signal) {
        synchronized (storeLock) {
            if (detection.isSuppressDuplicates() && isDuplicate(signal)) {
                log.debug("Suppressed repeat {} signal on {}", signal.getSignalType().getValue(), signal.getMetricName());
                meterRegistry.counter("pmm.signals.suppressed",
                        "type", signal.getSignalType().getValue()).increment();
                return false;
            }
            signalRepository.save(signal);
        }

        if (signal.getSeverity().isAtLeast(Severity.HIGH)) {
            log.warn("Signal {} detected: {}", signal.getSignalId(), signal.getDescription());
        } else {
            log.info("Signal {} detected: {}", signal.getSignalId(), signal.getDescription());
        }
        meterRegistry.counter("pmm.signals.detected",
                "type", signal.getSignalType().getValue(),
                "severity", signal.getSeverity().getValue()
        ).increment();

        eventPublisher.publishEvent(new SignalDetectedEvent(signal));
        return true;
    }

    private boolean isDuplicate(Signal candidate) {
        return signalRepository.findOpenByMetric(candidate.getMetricName()).stream()
                .anyMatch(existing -> existing.getSignalType() == candidate.getSignalType()
                        && Double.compare(existing.getDetectedValue(), candidate.getDetectedValue()) == 0);
    }

    private static void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Actor identity is required");
        }
    }
}
