package com.company.pmm.service;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.AiInteraction;
import com.company.pmm.domain.Alert;
import com.company.pmm.domain.MetricPoint;
import com.company.pmm.domain.PerformanceSnapshot;
import com.company.pmm.domain.Signal;
import com.company.pmm.domain.UserFeedback;
import com.company.pmm.dto.request.FeedbackRequest;
import com.company.pmm.dto.request.InteractionRequest;
import com.company.pmm.dto.request.MetricRecordRequest;
import com.company.pmm.dto.request.PerformanceSnapshotRequest;
import com.company.pmm.dto.response.IngestionSummary;
import com.company.pmm.repository.FeedbackRepository;
import com.company.pmm.repository.InteractionRepository;
import com.company.pmm.repository.MetricSeriesRepository;
import com.company.pmm.repository.PerformanceSnapshotRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for interactions, feedback, performance snapshots and raw metric values.
 * Every metric value goes to the series store first and is then checked against its band.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionService {

    static final String RESPONSE_TIME = "response_time";
    static final String USER_SATISFACTION = "user_satisfaction";

    private final MetricSeriesRepository metricRepository;
    private final InteractionRepository interactionRepository;
    private final FeedbackRepository feedbackRepository;
    private final PerformanceSnapshotRepository snapshotRepository;
    private final AlertService alertService;
    private final SignalService signalService;
    private final MonitoringProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public IngestionSummary logInteraction(InteractionRequest request) {
        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : clock.instant();

        AiInteraction interaction = AiInteraction.builder()
                .interactionId(request.getInteractionId())
                .timestamp(timestamp)
                .userId(request.getUserId())
                .prompt(request.getPrompt())
                .response(request.getResponse())
                .responseTime(request.getResponseTime())
                .modelVersion(request.getModelVersion())
                .metadata(nullToEmpty(request.getMetadata()))
                .demographics(nullToEmpty(request.getDemographics()))
                .metrics(nullToEmpty(request.getMetrics()))
                .build();
        interactionRepository.save(interaction);

        Map<String, Double> values = new LinkedHashMap<>();
        values.put(RESPONSE_TIME, interaction.getResponseTime());
        interaction.getMetrics().forEach((name, value) -> {
            if (value != null) {
                values.put(name, value);
            }
        });

        log.debug("Logged interaction {} with {} metric values", interaction.getInteractionId(), values.size());
        meterRegistry.counter("pmm.ingest.interactions").increment();

        return record(interaction.getInteractionId(), values, timestamp);
    }

    public IngestionSummary submitFeedback(FeedbackRequest request) {
        if (request.getRating() == null || request.getRating() < 1 || request.getRating() > 5) {
            throw new IllegalArgumentException("Rating must be between 1 and 5, got " + request.getRating());
        }

        Instant now = clock.instant();
        String feedbackId = request.getFeedbackId() != null
                ? request.getFeedbackId()
                : "FB-" + UUID.randomUUID().toString().substring(0, 8);

        UserFeedback feedback = UserFeedback.builder()
                .feedbackId(feedbackId)
                .interactionId(request.getInteractionId())
                .userId(request.getUserId())
                .timestamp(now)
                .rating(request.getRating())
                .comment(request.getComment())
                .issues(request.getIssues() != null ? request.getIssues() : new ArrayList<>())
                .build();
        feedbackRepository.save(feedback);

        log.debug("Feedback {} for interaction {}: rating {}", feedbackId, feedback.getInteractionId(), feedback.getRating());
        meterRegistry.counter("pmm.ingest.feedback").increment();

        return record(feedbackId, Map.of(USER_SATISFACTION, feedback.getRating() / 5.0), now);
    }

    public PerformanceSnapshot recordPerformanceSnapshot(PerformanceSnapshotRequest request) {
        PerformanceSnapshot snapshot = PerformanceSnapshot.builder()
                .timestamp(request.getTimestamp() != null ? request.getTimestamp() : clock.instant())
                .responseTimeAvg(request.getResponseTimeAvg())
                .responseTimeP95(request.getResponseTimeP95())
                .throughput(request.getThroughput())
                .errorRate(request.getErrorRate())
                .availability(request.getAvailability())
                .activeUsers(request.getActiveUsers())
                .system(nullToEmpty(request.getSystem()))
                .build();

        snapshotRepository.save(snapshot);
        meterRegistry.counter("pmm.ingest.snapshots").increment();
        return snapshot;
    }

    public IngestionSummary recordMetric(MetricRecordRequest request) {
        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : clock.instant();
        return record(request.getMetricName(), Map.of(request.getMetricName(), request.getValue()), timestamp);
    }

    private IngestionSummary record(String id, Map<String, Double> values, Instant timestamp) {
        List<Alert> alerts = new ArrayList<>();
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            MetricPoint point = metricRepository.append(entry.getKey(), entry.getValue(), timestamp);
            alertService.evaluate(point).ifPresent(alerts::add);
        }

        List<Signal> signals = properties.getDetection().isSynchronous()
                ? signalService.detect(values.keySet())
                : Collections.emptyList();

        return IngestionSummary.builder()
                .status("success")
                .id(id)
                .metricsRecorded(values.size())
                .alertsTriggered(alerts)
                .signalsDetected(signals)
                .build();
    }

    private static <K, V> Map<K, V> nullToEmpty(Map<K, V> map) {
        return map != null ? map : new HashMap<>();
    }
}
