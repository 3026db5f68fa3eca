package com.company.pmm.scheduled;

import com.company.pmm.dto.response.DetectionRunResponse;
import com.company.pmm.service.SignalService;
import com.company.pmm.support.MutableClock;
import com.company.pmm.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class SignalDetectionJobTest {

    @Mock
    private SignalService signalService;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private SignalDetectionJob job;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.NOW);
        meterRegistry = new SimpleMeterRegistry();
        job = new SignalDetectionJob(signalService, meterRegistry, clock);
    }

    @Test
    @DisplayName("A completed pass is counted and timed on the injected clock")
    void completedPassIsCounted() {
        given(signalService.runDetection()).willAnswer(invocation -> {
            clock.advance(Duration.ofMillis(250));
            return new DetectionRunResponse(clock.instant(), 3, 0, List.of());
        });

        job.detectSignals();

        assertThat(meterRegistry.counter("pmm.detection.scheduled.runs").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("pmm.detection.scheduled.failures").count()).isZero();
        assertThat(clock.instant()).isEqualTo(TestFixtures.NOW.plusMillis(250));
    }

    @Test
    @DisplayName("A failing pass is logged and counted without escaping the scheduler")
    void failedPassIsCounted() {
        given(signalService.runDetection()).willThrow(new IllegalStateException("store unavailable"));

        job.detectSignals();

        assertThat(meterRegistry.counter("pmm.detection.scheduled.runs").count()).isZero();
        assertThat(meterRegistry.counter("pmm.detection.scheduled.failures").count()).isEqualTo(1.0);
    }
}
