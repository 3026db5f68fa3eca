package com.company.pmm.service;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.PerformanceSnapshot;
import com.company.pmm.domain.Signal;
import com.company.pmm.domain.enums.Severity;
import com.company.pmm.dto.request.FeedbackRequest;
import com.company.pmm.dto.request.InteractionRequest;
import com.company.pmm.dto.request.MetricRecordRequest;
import com.company.pmm.dto.request.PerformanceSnapshotRequest;
import com.company.pmm.dto.response.IngestionSummary;
import com.company.pmm.repository.AlertRepository;
import com.company.pmm.repository.FeedbackRepository;
import com.company.pmm.repository.InteractionRepository;
import com.company.pmm.repository.MetricSeriesRepository;
import com.company.pmm.repository.PerformanceSnapshotRepository;
import com.company.pmm.support.MutableClock;
import com.company.pmm.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionServiceTest {

    private MutableClock clock;
    private MonitoringProperties properties;
    private MetricSeriesRepository metrics;
    private InteractionRepository interactions;
    private FeedbackRepository feedback;
    private PerformanceSnapshotRepository snapshots;
    private SignalService signalService;
    private SimpleMeterRegistry meterRegistry;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.NOW);
        properties = TestFixtures.properties();
        metrics = new MetricSeriesRepository(properties, clock);
        interactions = new InteractionRepository(properties, clock);
        feedback = new FeedbackRepository(properties, clock);
        snapshots = new PerformanceSnapshotRepository(properties, clock);
        signalService = mock(SignalService.class);
        meterRegistry = new SimpleMeterRegistry();
        AlertService alertService = new AlertService(new AlertRepository(), new ThresholdEvaluator(clock),
                properties, mock(ApplicationEventPublisher.class), meterRegistry, clock);
        service = new IngestionService(metrics, interactions, feedback, snapshots,
                alertService, signalService, properties, meterRegistry, clock);
    }

    @Test
    @DisplayName("An interaction records its response time and every attached metric")
    void interactionRecordsMetrics() {
        IngestionSummary summary = service.logInteraction(InteractionRequest.builder()
                .interactionId("int-1")
                .prompt("What is the refund policy?")
                .response("Refunds are accepted within 30 days.")
                .responseTime(0.42)
                .metrics(Map.of("response_accuracy", 0.97))
                .build());

        assertThat(summary.getStatus()).isEqualTo("success");
        assertThat(summary.getId()).isEqualTo("int-1");
        assertThat(summary.getMetricsRecorded()).isEqualTo(2);
        assertThat(summary.getAlertsTriggered()).isEmpty();
        assertThat(metrics.latest("response_time")).map(MetricPoint::getValue).contains(0.42);
        assertThat(metrics.latest("response_accuracy")).map(MetricPoint::getTimestamp).contains(TestFixtures.NOW);
        assertThat(interactions.countTotal()).isEqualTo(1);
        assertThat(meterRegistry.counter("pmm.ingest.interactions").count()).isEqualTo(1.0);
    }

    @Test
    void interactionKeepsClientTimestamp() {
        Instant earlier = TestFixtures.NOW.minus(Duration.ofMinutes(3));

        service.logInteraction(InteractionRequest.builder()
                .interactionId("int-2").prompt("p").response("r").responseTime(1.0)
                .timestamp(earlier)
                .build());

        assertThat(metrics.latest("response_time")).map(MetricPoint::getTimestamp).contains(earlier);
    }

    @Test
    void breachingMetricTriggersAlert() {
        IngestionSummary summary = service.logInteraction(InteractionRequest.builder()
                .interactionId("int-3").prompt("p").response("r").responseTime(0.5)
                .metrics(Map.of("hallucination_rate", 0.12))
                .build());

        assertThat(summary.getAlertsTriggered()).hasSize(1);
        assertThat(summary.getAlertsTriggered().get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(summary.getAlertsTriggered().get(0).getMetricName()).isEqualTo("hallucination_rate");
    }

    @Test
    @DisplayName("Feedback rating is recorded as user_satisfaction = rating / 5")
    void feedbackRecordsSatisfaction() {
        IngestionSummary summary = service.submitFeedback(FeedbackRequest.builder()
                .interactionId("int-1").rating(4).comment("Helpful")
                .build());

        assertThat(summary.getId()).startsWith("FB-");
        assertThat(metrics.latest(IngestionService.USER_SATISFACTION)).map(MetricPoint::getValue).contains(0.8);
        assertThat(feedback.countTotal()).isEqualTo(1);
    }

    @Test
    void feedbackKeepsClientId() {
        IngestionSummary summary = service.submitFeedback(FeedbackRequest.builder()
                .feedbackId("fb-42").interactionId("int-1").rating(5)
                .build());

        assertThat(summary.getId()).isEqualTo("fb-42");
    }

    @Test
    void ratingOutOfRangeIsRejected() {
        assertThatThrownBy(() -> service.submitFeedback(FeedbackRequest.builder().rating(6).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 1 and 5");
        assertThat(metrics.metricCount()).isZero();
    }

    @Test
    void snapshotIsStored() {
        PerformanceSnapshot snapshot = service.recordPerformanceSnapshot(PerformanceSnapshotRequest.builder()
                .responseTimeAvg(180.0).responseTimeP95(400.0).throughput(120.0)
                .errorRate(0.3).availability(99.95).activeUsers(42)
                .build());

        assertThat(snapshot.getTimestamp()).isEqualTo(TestFixtures.NOW);
        assertThat(snapshots.findLatest()).contains(snapshot);
    }

    @Test
    void detectionIsDeferredByDefault() {
        service.recordMetric(new MetricRecordRequest("response_accuracy", 0.93, null));

        verify(signalService, never()).detect(any());
    }

    @Test
    @DisplayName("With synchronous detection the ingested metrics are scanned immediately")
    void synchronousDetection() {
        properties.getDetection().setSynchronous(true);
        Signal signal = Signal.builder().signalId("SIG-1").build();
        when(signalService.detect(Set.of("response_accuracy"))).thenReturn(List.of(signal));

        IngestionSummary summary = service.recordMetric(new MetricRecordRequest("response_accuracy", 0.93, null));

        assertThat(summary.getSignalsDetected()).containsExactly(signal);
    }
}
