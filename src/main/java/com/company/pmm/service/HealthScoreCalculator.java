package com.company.pmm.service;

import com.company.pmm.domain.Alert;
import com.company.pmm.domain.Signal;
import com.company.pmm.domain.enums.HealthStatus;
import com.company.pmm.domain.enums.Severity;
import com.company.pmm.dto.response.HealthScore;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rolls the active signal and alert sets into a 0-100 score. Always computed from
 * the lists it is given; nothing is cached.
 */
@Component
public class HealthScoreCalculator {

    static final int MAX_SCORE = 100;

    private static final Map<Severity, Integer> SIGNAL_PENALTY = new EnumMap<>(Map.of(
            Severity.CRITICAL, 15,
            Severity.HIGH, 10,
            Severity.MEDIUM, 5,
            Severity.LOW, 5));

    private static final Map<Severity, Integer> ALERT_PENALTY = new EnumMap<>(Map.of(
            Severity.CRITICAL, 20,
            Severity.HIGH, 10,
            Severity.MEDIUM, 0,
            Severity.LOW, 0));

    public HealthScore calculate(List<Signal> activeSignals, List<Alert> activeAlerts) {
        int score = MAX_SCORE;
        for (Signal signal : activeSignals) {
            score -= SIGNAL_PENALTY.get(signal.getSeverity());
        }
        for (Alert alert : activeAlerts) {
            score -= ALERT_PENALTY.get(alert.getSeverity());
        }
        score = Math.max(0, Math.min(MAX_SCORE, score));

        return new HealthScore(score, HealthStatus.fromScore(score), activeSignals.size(), activeAlerts.size());
    }
}
