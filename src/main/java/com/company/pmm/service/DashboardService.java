package com.company.pmm.service;

import com.company.pmm.domain.Alert;
import com.company.pmm.domain.Signal;
import com.company.pmm.domain.UserFeedback;
import com.company.pmm.domain.enums.SignalStatus;
import com.company.pmm.dto.response.DashboardOverview;
import com.company.pmm.dto.response.HealthScore;
import com.company.pmm.dto.response.KpiSummary;
import com.company.pmm.dto.response.SystemStats;
import com.company.pmm.repository.AlertRepository;
import com.company.pmm.repository.FeedbackRepository;
import com.company.pmm.repository.InteractionRepository;
import com.company.pmm.repository.SignalRepository;
import com.company.pmm.util.SeriesStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health overview, KPIs and system statistics. Everything is recomputed per call
 * from one read of the signal and alert stores.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DashboardService {

    private static final Duration DAY = Duration.ofDays(1);
    private static final Duration WEEK = Duration.ofDays(7);

    private final SignalRepository signalRepository;
    private final AlertRepository alertRepository;
    private final InteractionRepository interactionRepository;
    private final FeedbackRepository feedbackRepository;
    private final HealthScoreCalculator healthScoreCalculator;
    private final MetricsQueryService metricsQueryService;
    private final ComplaintService complaintService;
    private final RegulatoryReportService regulatoryReportService;
    private final Clock clock;

    public HealthScore getHealthScore() {
        List<Signal> activeSignals = signalRepository.findByStatus(SignalStatus.ACTIVE);
        List<Alert> activeAlerts = alertRepository.findOpen();
        return healthScoreCalculator.calculate(activeSignals, activeAlerts);
    }

    public DashboardOverview getOverview() {
        Instant now = clock.instant();
        HealthScore health = getHealthScore();

        Map<String, DashboardOverview.TrendSummary> trends = new LinkedHashMap<>();
        metricsQueryService.getAllTrends(DAY).forEach((name, trend) -> trends.put(name,
                new DashboardOverview.TrendSummary(trend.getTrendDirection().getValue(), trend.getCurrentValue())));

        log.debug("Overview computed: score={} signals={} alerts={}",
                health.getScore(), health.getActiveSignals(), health.getActiveAlerts());

        return DashboardOverview.builder()
                .timestamp(now)
                .healthScore(health.getScore())
                .healthStatus(health.getStatus())
                .activeSignals(health.getActiveSignals())
                .activeAlerts(health.getActiveAlerts())
                .openComplaints(complaintService.countOpen())
                .feedbackToday(feedbackRepository.findSince(now.minus(DAY)).size())
                .metricsTracked(metricsQueryService.countTrackedMetrics())
                .trendsSummary(trends)
                .complianceStatus(regulatoryReportService.getComplianceStatus().getOverallStatus())
                .lastReport(regulatoryReportService.latestReportId().orElse(null))
                .build();
    }

    public KpiSummary getKpis() {
        Instant now = clock.instant();

        long last24h = interactionRepository.countSince(now.minus(DAY));
        long last7d = interactionRepository.countSince(now.minus(WEEK));

        List<UserFeedback> feedback = feedbackRepository.findSince(now.minus(WEEK));
        double avgRating = feedback.stream().mapToInt(UserFeedback::getRating).average().orElse(0.0);
        double satisfactionRate = feedback.isEmpty()
                ? 0.0
                : (double) feedback.stream().filter(UserFeedback::isSatisfied).count() / feedback.size();

        Map<String, Double> metrics = new LinkedHashMap<>();
        metricsQueryService.getCurrentMetrics().forEach((name, current) -> metrics.put(name, current.getCurrentValue()));

        return KpiSummary.builder()
                .timestamp(now)
                .interactions(new KpiSummary.Interactions(last24h, last7d, SeriesStatistics.round(last7d / 7.0, 1)))
                .feedback(new KpiSummary.Feedback(
                        feedback.size(),
                        SeriesStatistics.round(avgRating, 2),
                        SeriesStatistics.round(satisfactionRate, 4)))
                .metrics(metrics)
                .alerts(new KpiSummary.Alerts(alertRepository.countOpen(), alertRepository.findSince(now.minus(DAY)).size()))
                .signals(new KpiSummary.Signals(
                        signalRepository.countByStatus(SignalStatus.ACTIVE),
                        signalRepository.findSince(now.minus(WEEK), null).size()))
                .build();
    }

    public SystemStats getStats() {
        Instant now = clock.instant();
        return SystemStats.builder()
                .timestamp(now)
                .totalInteractions(interactionRepository.countTotal())
                .interactions24h(interactionRepository.countSince(now.minus(DAY)))
                .totalFeedback(feedbackRepository.countTotal())
                .totalAlerts(alertRepository.findAll().size())
                .activeAlerts(alertRepository.countOpen())
                .totalSignals(signalRepository.findAll().size())
                .activeSignals(signalRepository.countByStatus(SignalStatus.ACTIVE))
                .metricsTracked(metricsQueryService.countTrackedMetrics())
                .build();
    }
}
