package com.company.pmm.repository;

import com.company.pmm.domain.Signal;
import com.company.pmm.domain.enums.SignalStatus;
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

@Repository
public class SignalRepository {

    private static final Comparator<Signal> BY_TIME = Comparator
            .comparing(Signal::getTimestamp)
            .thenComparingLong((Signal signal) -> IdGenerator.sequenceOf(signal.getSignalId()))
            .thenComparing(Signal::getSignalId);

    private final ConcurrentMap<String, Signal> signals = new ConcurrentHashMap<>();

    public Signal save(Signal signal) {
        signals.put(signal.getSignalId(), signal);
        return signal;
    }

    public Optional<Signal> findById(String signalId) {
        return Optional.ofNullable(signals.get(signalId));
    }

    public Optional<Signal> update(String signalId, UnaryOperator<Signal> transition) {
        return Optional.ofNullable(signals.computeIfPresent(signalId, (id, current) -> transition.apply(current)));
    }

    public List<Signal> findAll() {
        return find(signal -> true);
    }

    public List<Signal> findByStatus(SignalStatus status) {
        return find(signal -> signal.getStatus() == status);
    }

    public List<Signal> findOpenByMetric(String metricName) {
        return find(signal -> signal.isOpen() && metricName.equals(signal.getMetricName()));
    }

    /**
     * Signals detected at or after {@code since}, optionally restricted to a status.
     */
    public List<Signal> findSince(Instant since, SignalStatus status) {
        return find(signal -> !signal.getTimestamp().isBefore(since)
                && (status == null || signal.getStatus() == status));
    }

    public long countByStatus(SignalStatus status) {
        return signals.values().stream().filter(s -> s.getStatus() == status).count();
    }

    private List<Signal> find(Predicate<Signal> filter) {
        return signals.values().stream()
                .filter(filter)
                .sorted(BY_TIME)
                .collect(Collectors.toList());
    }
}
