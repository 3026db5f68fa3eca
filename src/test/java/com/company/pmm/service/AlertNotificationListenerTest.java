package com.company.pmm.service;

import com.company.pmm.domain.Alert;
import com.company.pmm.domain.Signal;
import com.company.pmm.domain.enums.Severity;
import com.company.pmm.event.AlertRaisedEvent;
import com.company.pmm.event.SignalDetectedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AlertNotificationListenerTest {

    @Mock
    private IncidentNotifier incidentNotifier;

    private SimpleMeterRegistry meterRegistry;
    private AlertNotificationListener listener;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        listener = new AlertNotificationListener(incidentNotifier, meterRegistry);
    }

    @Test
    void forwardsHighAlerts() {
        Alert alert = Alert.builder().alertId("ALT-1").severity(Severity.HIGH).build();

        listener.onAlertRaised(new AlertRaisedEvent(alert));

        verify(incidentNotifier).notifyAlert(alert);
        assertThat(meterRegistry.counter("pmm.notifications.sent", "kind", "alert").count()).isEqualTo(1.0);
    }

    @Test
    void ignoresMediumSignals() {
        Signal signal = Signal.builder().signalId("SIG-1").severity(Severity.MEDIUM).build();

        listener.onSignalDetected(new SignalDetectedEvent(signal));

        verify(incidentNotifier, never()).notifySignal(any());
    }

    @Test
    void bridgeFailureIsCountedNotPropagated() {
        Signal signal = Signal.builder().signalId("SIG-2").severity(Severity.CRITICAL).build();
        doThrow(new IllegalStateException("bridge down")).when(incidentNotifier).notifySignal(signal);

        assertThatCode(() -> listener.onSignalDetected(new SignalDetectedEvent(signal)))
                .doesNotThrowAnyException();
        assertThat(meterRegistry.counter("pmm.notifications.failed", "kind", "signal").count()).isEqualTo(1.0);
    }
}
