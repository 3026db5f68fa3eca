package com.company.pmm.repository;

import com.company.pmm.domain.Alert;
import com.company.pmm.util.IdGenerator;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Alert records keyed by id. Transitions replace the stored record atomically,
 * so concurrent updates of the same alert are serialized per key.
 */
@Repository
public class AlertRepository {

    private static final Comparator<Alert> BY_TIME = Comparator
            .comparing(Alert::getTimestamp)
            .thenComparingLong((Alert alert) -> IdGenerator.sequenceOf(alert.getAlertId()))
            .thenComparing(Alert::getAlertId);

    private final ConcurrentMap<String, Alert> alerts = new ConcurrentHashMap<>();

    public Alert save(Alert alert) {
        alerts.put(alert.getAlertId(), alert);
        return alert;
    }

    public Optional<Alert> findById(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    /**
     * Applies the transition to the current record and stores its result.
     *
     * @return the stored record, or empty when the id is unknown
     */
    public Optional<Alert> update(String alertId, UnaryOperator<Alert> transition) {
        return Optional.ofNullable(alerts.computeIfPresent(alertId, (id, current) -> transition.apply(current)));
    }

    public List<Alert> findAll() {
        return find(alert -> true);
    }

    public List<Alert> findOpen() {
        return find(Alert::isOpen);
    }

    public List<Alert> findOpenByMetric(String metricName) {
        return find(alert -> alert.isOpen() && metricName.equals(alert.getMetricName()));
    }

    public List<Alert> findSince(Instant since) {
        return find(alert -> !alert.getTimestamp().isBefore(since));
    }

    public long countOpen() {
        return alerts.values().stream().filter(Alert::isOpen).count();
    }

    private List<Alert> find(Predicate<Alert> filter) {
        return alerts.values().stream()
                .filter(filter)
                .sorted(BY_TIME)
                .collect(Collectors.toList());
    }
}
