package com.company.pmm.service;

import com.company.pmm.domain.Alert;
import com.company.pmm.domain.Signal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default notifier: writes the incident to the log. Replace with a @Primary bean to
 * forward incidents to a real bridge.
 */
@Component
@Slf4j
public class LoggingIncidentNotifier implements IncidentNotifier {

    @Override
    public void notifyAlert(Alert alert) {
        log.warn("INCIDENT alert {}: {} {} = {} (threshold {})",
                alert.getAlertId(),
                alert.getSeverity().getValue(),
                alert.getMetricName(),
                alert.getCurrentValue(),
                alert.getThreshold());
    }

    @Override
    public void notifySignal(Signal signal) {
        log.warn("INCIDENT signal {}: {} {} on {} - {}",
                signal.getSignalId(),
                signal.getSeverity().getValue(),
                signal.getSignalType().getValue(),
                signal.getMetricName(),
                signal.getDescription());
    }
}
