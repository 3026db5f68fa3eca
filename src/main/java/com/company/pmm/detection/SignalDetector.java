package com.company.pmm.detection;

import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.Signal;
import com.company.pmm.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs every registered {@link SignalRule} over a metric window and turns the
 * candidates into new ACTIVE signals. Pure with respect to the stores.
 */
@Component
@Slf4j
public class SignalDetector {

    private final List<SignalRule> rules;
    private final Clock clock;
    private final IdGenerator idGenerator = new IdGenerator("SIG", "yyyyMMddHHmmss");

    public SignalDetector(List<SignalRule> rules, Clock clock) {
        this.rules = List.copyOf(rules);
        this.clock = clock;
        log.info("Signal detector initialised with rules {}", rules.stream().map(SignalRule::type).collect(Collectors.toList()));
    }

    public List<Signal> detect(String metricName, List<MetricPoint> window) {
        List<Signal> detected = new ArrayList<>();
        if (window.isEmpty()) {
            return detected;
        }

        Instant now = clock.instant();
        for (SignalRule rule : rules) {
            Optional<SignalCandidate> candidate;
            try {
                candidate = rule.evaluate(metricName, window);
            } catch (RuntimeException e) {
                // One faulty rule must not hide the others
                log.error("Rule {} failed for metric {}", rule.type(), metricName, e);
                continue;
            }
            candidate.ifPresent(c -> detected.add(toSignal(c, now)));
        }
        return detected;
    }

    private Signal toSignal(SignalCandidate candidate, Instant now) {
        return Signal.builder()
                .signalId(idGenerator.next(now))
                .timestamp(now)
                .signalType(candidate.getType())
                .severity(candidate.getSeverity())
                .metricName(candidate.getMetricName())
                .detectedValue(candidate.getDetectedValue())
                .expectedValue(candidate.getExpectedValue())
                .deviationPct(candidate.getDeviationPct())
                .confidence(candidate.getConfidence())
                .description(candidate.getDescription())
                .context(candidate.getContext() != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(candidate.getContext()))
                        : Map.of())
                .build();
    }
}
