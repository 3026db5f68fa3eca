package com.company.pmm.detection;

import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.enums.SignalType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Extension point for distribution drift detection. No drift model is configured,
 * so nothing is emitted.
 */
@Component
@Order(5)
public class DriftRule implements SignalRule {

    @Override
    public SignalType type() {
        return SignalType.DRIFT_DETECTED;
    }

    @Override
    public Optional<SignalCandidate> evaluate(String metricName, List<MetricPoint> window) {
        return Optional.empty();
    }
}
