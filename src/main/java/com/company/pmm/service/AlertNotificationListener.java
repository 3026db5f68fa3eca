package com.company.pmm.service;

import com.company.pmm.domain.Alert;
import com.company.pmm.domain.Signal;
import com.company.pmm.domain.enums.Severity;
import com.company.pmm.event.AlertRaisedEvent;
import com.company.pmm.event.SignalDetectedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Forwards high and critical alerts and signals to the incident bridge, off the
 * ingestion thread. A failing bridge never affects the stored alert or signal.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertNotificationListener {

    static final Severity NOTIFY_AT = Severity.HIGH;

    private final IncidentNotifier incidentNotifier;
    private final MeterRegistry meterRegistry;

    @EventListener
    @Async
    public void onAlertRaised(AlertRaisedEvent event) {
        Alert alert = event.getAlert();
        if (!alert.getSeverity().isAtLeast(NOTIFY_AT)) {
            return;
        }

        try {
            incidentNotifier.notifyAlert(alert);
            meterRegistry.counter("pmm.notifications.sent", "kind", "alert").increment();
        } catch (Exception e) {
            log.error("Failed to forward alert {} to incident bridge", alert.getAlertId(), e);
            meterRegistry.counter("pmm.notifications.failed", "kind", "alert").increment();
        }
    }

    @EventListener
    @Async
    public void onSignalDetected(SignalDetectedEvent event) {
        Signal signal = event.getSignal();
        if (!signal.getSeverity().isAtLeast(NOTIFY_AT)) {
            return;
        }

        try {
            incidentNotifier.notifySignal(signal);
            meterRegistry.counter("pmm.notifications.sent", "kind", "signal").increment();
        } catch (Exception e) {
            log.error("Failed to forward signal {} to incident bridge", signal.getSignalId(), e);
            meterRegistry.counter("pmm.notifications.failed", "kind", "signal").increment();
        }
    }
}
