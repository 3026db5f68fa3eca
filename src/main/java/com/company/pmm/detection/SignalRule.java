package com.company.pmm.detection;

import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.enums.SignalType;

import java.util.List;
import java.util.Optional;

/**
 * One detection strategy applied to a metric window. Implementations are stateless
 * and must not touch the stores; the window is an oldest-first copy.
 */
public interface SignalRule {

    SignalType type();

    Optional<SignalCandidate> evaluate(String metricName, List<MetricPoint> window);
}
