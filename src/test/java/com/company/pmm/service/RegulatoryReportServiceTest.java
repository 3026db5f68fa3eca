package com.company.pmm.service;

import com.company.pmm.domain.Alert;
import com.company.pmm.domain.RegulatoryReport;
import com.company.pmm.domain.Signal;
import com.company.pmm.domain.enums.ReportStatus;
import com.company.pmm.domain.enums.ReportType;
import com.company.pmm.domain.enums.Severity;
import com.company.pmm.domain.enums.SignalStatus;
import com.company.pmm.domain.enums.SignalType;
import com.company.pmm.dto.response.ComplianceStatus;
import com.company.pmm.exception.ReportNotFoundException;
import com.company.pmm.repository.AlertRepository;
import com.company.pmm.repository.MetricSeriesRepository;
import com.company.pmm.repository.RegulatoryReportRepository;
import com.company.pmm.repository.SignalRepository;
import com.company.pmm.support.MutableClock;
import com.company.pmm.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegulatoryReportServiceTest {

    private MutableClock clock;
    private MetricSeriesRepository metrics;
    private AlertRepository alerts;
    private SignalRepository signals;
    private RegulatoryReportService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.NOW);
        var properties = TestFixtures.properties();
        metrics = new MetricSeriesRepository(properties, clock);
        alerts = new AlertRepository();
        signals = new SignalRepository();
        MetricsQueryService metricsQueryService =
                new MetricsQueryService(metrics, new TrendAnalyzer(properties), clock);
        service = new RegulatoryReportService(new RegulatoryReportRepository(), alerts, signals,
                metricsQueryService, clock);
    }

    @Test
    @DisplayName("Data collection is pending until the first metric arrives")
    void complianceWithoutData() {
        ComplianceStatus status = service.getComplianceStatus();

        assertThat(status.getFramework()).isEqualTo("EU AI Act");
        assertThat(status.getArticles()).hasSize(5);
        assertThat(status.getArticles().get("article_72_2").getStatus()).isEqualTo(RegulatoryReportService.PENDING);
        assertThat(status.getOverallStatus()).isEqualTo(RegulatoryReportService.PARTIAL);
        assertThat(status.getNextAuditDue()).isEqualTo(TestFixtures.NOW.plus(Duration.ofDays(90)));
    }

    @Test
    void complianceWithData() {
        metrics.append("response_accuracy", 0.95, TestFixtures.NOW);

        ComplianceStatus status = service.getComplianceStatus();

        assertThat(status.getOverallStatus()).isEqualTo(RegulatoryReportService.COMPLIANT);
        assertThat(status.getArticles().values())
                .allSatisfy(r -> assertThat(r.getStatus()).isEqualTo(RegulatoryReportService.COMPLIANT));
    }

    @Test
    void reportAggregatesThePeriod() {
        metrics.append("response_accuracy", 0.93, TestFixtures.NOW.minus(Duration.ofHours(1)));
        metrics.append("response_accuracy", 0.95, TestFixtures.NOW);
        alerts.save(alert("ALT-1", Severity.CRITICAL, TestFixtures.NOW.minus(Duration.ofDays(2))));
        alerts.save(alert("ALT-2", Severity.HIGH, TestFixtures.NOW.minus(Duration.ofDays(3))));
        alerts.save(alert("ALT-3", Severity.HIGH, TestFixtures.NOW.minus(Duration.ofDays(45))));
        signals.save(signal("SIG-1", SignalStatus.FALSE_POSITIVE));
        signals.save(signal("SIG-2", SignalStatus.ACTIVE));

        RegulatoryReport report = service.generate(ReportType.PERIODIC, 30);

        assertThat(report.getReportId()).startsWith("REG-20250315-");
        assertThat(report.getStatus()).isEqualTo(ReportStatus.DRAFT);
        assertThat(report.getTitle()).isEqualTo("EU AI Act Article 72 Compliance Report - March 2025");
        assertThat(report.getPeriodStart()).isEqualTo(TestFixtures.NOW.minus(Duration.ofDays(30)));
        assertThat(report.getPeriodEnd()).isEqualTo(TestFixtures.NOW);
        assertThat(report.getMetricsSummary()).containsOnlyKeys("response_accuracy");
        assertThat(report.getMetricsSummary().get("response_accuracy").getCount()).isEqualTo(2);

        assertThat(report.getIncidentsSummary().getTotalAlerts()).isEqualTo(2);
        assertThat(report.getIncidentsSummary().getCriticalCount()).isEqualTo(1);
        assertThat(report.getIncidentsSummary().getHighCount()).isEqualTo(1);
        assertThat(report.getSignalsSummary())
                .containsEntry("total_signals", 2)
                .containsEntry("false_positives", 1L);

        assertThat(report.getSummary()).contains("Metrics tracked: 1", "Critical incidents: 1");
        assertThat(report.getRecommendations())
                .contains("Review and address root causes of critical incidents")
                .last().isEqualTo("Continue regular monitoring and documentation updates");
    }

    @Test
    void quietPeriodOnlyRecommendsRoutineMonitoring() {
        RegulatoryReport report = service.generate(ReportType.AUDIT, 7);

        assertThat(report.getRecommendations())
                .containsExactly("Continue regular monitoring and documentation updates");
    }

    @Test
    void listAndGet() {
        RegulatoryReport periodic = service.generate(ReportType.PERIODIC, 30);
        clock.advance(Duration.ofMinutes(1));
        RegulatoryReport incident = service.generate(ReportType.INCIDENT, 7);

        assertThat(service.list(ReportType.INCIDENT, null)).containsExactly(incident);
        assertThat(service.list(null, ReportStatus.DRAFT)).hasSize(2);
        assertThat(service.list(null, ReportStatus.SUBMITTED)).isEmpty();
        assertThat(service.get(periodic.getReportId())).isEqualTo(periodic);
        assertThat(service.latestReportId()).contains(incident.getReportId());
        assertThatThrownBy(() -> service.get("REG-missing")).isInstanceOf(ReportNotFoundException.class);
    }

    private static Alert alert(String id, Severity severity, Instant at) {
        return Alert.builder()
                .alertId(id).timestamp(at).severity(severity)
                .alertType(ThresholdEvaluator.ALERT_TYPE).metricName("response_accuracy")
                .build();
    }

    private static Signal signal(String id, SignalStatus status) {
        return Signal.builder()
                .signalId(id).timestamp(TestFixtures.NOW.minus(Duration.ofDays(1)))
                .signalType(SignalType.ANOMALY).severity(Severity.MEDIUM)
                .metricName("response_accuracy").status(status)
                .build();
    }
}
