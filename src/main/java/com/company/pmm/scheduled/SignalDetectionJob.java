package com.company.pmm.scheduled;

import com.company.pmm.dto.response.DetectionRunResponse;
import com.company.pmm.service.SignalService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodic detection pass over every tracked metric (default every 5 minutes).
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "pmm.detection.scheduled.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SignalDetectionJob {

    private final SignalService signalService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${pmm.detection.scheduled.interval-ms:300000}",
            initialDelayString = "${pmm.detection.scheduled.initial-delay-ms:60000}"
    )
    public void detectSignals() {
        Instant startTime = clock.instant();

        try {
            DetectionRunResponse result = signalService.runDetection();

            Duration executionTime = Duration.between(startTime, clock.instant());
            log.info("Scheduled detection completed: {} signals over {} metrics in {}ms",
                    result.getSignalsDetected(), result.getMetricsScanned(), executionTime.toMillis());

            meterRegistry.counter("pmm.detection.scheduled.runs").increment();
        } catch (Exception e) {
            log.error("Scheduled signal detection failed", e);
            meterRegistry.counter("pmm.detection.scheduled.failures").increment();
        }
    }
}
