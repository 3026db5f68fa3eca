package com.company.pmm.detection;

import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.enums.SignalType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Placeholder for the threshold_breach signal type. Band crossings are already
 * raised as alerts at ingestion time, so this rule never emits a signal.
 */
@Component
@Order(4)
public class ThresholdBreachRule implements SignalRule {

    @Override
    public SignalType type() {
        return SignalType.THRESHOLD_BREACH;
    }

    @Override
    public Optional<SignalCandidate> evaluate(String metricName, List<MetricPoint> window) {
        return Optional.empty();
    }
}
