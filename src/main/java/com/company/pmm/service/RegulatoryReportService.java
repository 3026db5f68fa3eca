package com.company.pmm.service;

import com.company.pmm.domain.Alert;
import com.company.pmm.domain.RegulatoryReport;
import com.company.pmm.domain.Signal;
import com.company.pmm.domain.enums.ReportStatus;
import com.company.pmm.domain.enums.ReportType;
import com.company.pmm.domain.enums.SignalStatus;
import com.company.pmm.dto.response.ComplianceStatus;
import com.company.pmm.dto.response.IncidentsSummary;
import com.company.pmm.dto.response.MetricSummary;
import com.company.pmm.exception.ReportNotFoundException;
import com.company.pmm.repository.AlertRepository;
import com.company.pmm.repository.RegulatoryReportRepository;
import com.company.pmm.repository.SignalRepository;
import com.company.pmm.util.IdGenerator;
import com.company.pmm.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * EU AI Act Article 72 compliance checklist and report content assembly.
 * Rendering the report into a document happens downstream.
 */
@Service
@Slf4j
public class RegulatoryReportService {

    static final String COMPLIANT = "compliant";
    static final String PENDING = "pending";
    static final String PARTIAL = "partially_compliant";

    private static final Map<String, String> ARTICLE_72_REQUIREMENTS = new LinkedHashMap<>();

    static {
        ARTICLE_72_REQUIREMENTS.put("article_72_1", "Post-market monitoring system established");
        ARTICLE_72_REQUIREMENTS.put("article_72_2", "Data collection and analysis procedures defined");
        ARTICLE_72_REQUIREMENTS.put("article_72_3", "Serious incident reporting mechanism in place");
        ARTICLE_72_REQUIREMENTS.put("article_72_4", "Corrective action procedures established");
        ARTICLE_72_REQUIREMENTS.put("article_72_5", "Documentation maintained and updated");
    }

    private static final Duration AUDIT_INTERVAL = Duration.ofDays(90);
    private static final int ALERT_FATIGUE_LIMIT = 10;
    private static final DateTimeFormatter TITLE_MONTH =
            DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private final RegulatoryReportRepository reportRepository;
    private final AlertRepository alertRepository;
    private final SignalRepository signalRepository;
    private final MetricsQueryService metricsQueryService;
    private final Clock clock;
    private final IdGenerator idGenerator = new IdGenerator("REG", "yyyyMMdd");

    public RegulatoryReportService(RegulatoryReportRepository reportRepository,
                                   AlertRepository alertRepository,
                                   SignalRepository signalRepository,
                                   MetricsQueryService metricsQueryService,
                                   Clock clock) {
        this.reportRepository = reportRepository;
        this.alertRepository = alertRepository;
        this.signalRepository = signalRepository;
        this.metricsQueryService = metricsQueryService;
        this.clock = clock;
    }

    public ComplianceStatus getComplianceStatus() {
        Instant now = clock.instant();
        boolean collectingData = metricsQueryService.countTrackedMetrics() > 0;

        Map<String, ComplianceStatus.Requirement> articles = new LinkedHashMap<>();
        ARTICLE_72_REQUIREMENTS.forEach((article, requirement) -> {
            String status = "article_72_2".equals(article) && !collectingData ? PENDING : COMPLIANT;
            articles.put(article, new ComplianceStatus.Requirement(requirement, status, now));
        });

        boolean allCompliant = articles.values().stream().allMatch(r -> COMPLIANT.equals(r.getStatus()));

        return ComplianceStatus.builder()
                .framework("EU AI Act")
                .articlesCovered(List.of("Article 72"))
                .overallStatus(allCompliant ? COMPLIANT : PARTIAL)
                .articles(articles)
                .lastUpdated(now)
                .nextAuditDue(now.plus(AUDIT_INTERVAL))
                .systemClassification("High-Risk AI System")
                .monitoringStatus("Active")
                .build();
    }

    public RegulatoryReport generate(ReportType reportType, int periodDays) {
        Instant end = clock.instant();
        Instant start = end.minus(TimeUtils.days(periodDays));

        Map<String, MetricSummary> metrics = metricsQueryService.summarize(null, start, end);
        IncidentsSummary incidents = incidentsSummary(start, end);
        Map<String, Object> signals = signalsSummary(start, end);

        RegulatoryReport report = RegulatoryReport.builder()
                .reportId(idGenerator.next(end))
                .createdAt(end)
                .reportType(reportType)
                .periodStart(start)
                .periodEnd(end)
                .status(ReportStatus.DRAFT)
                .title("EU AI Act Article 72 Compliance Report - " + TITLE_MONTH.format(end))
                .summary(executiveSummary(metrics, incidents))
                .metricsSummary(metrics)
                .incidentsSummary(incidents)
                .signalsSummary(signals)
                .complianceStatus(getComplianceStatus())
                .recommendations(recommendations(incidents, signals))
                .build();

        reportRepository.save(report);
        log.info("Generated {} report {} covering {} days ({} metrics, {} alerts)",
                reportType.getValue(), report.getReportId(), periodDays, metrics.size(), incidents.getTotalAlerts());
        return report;
    }

    public List<RegulatoryReport> list(ReportType type, ReportStatus status) {
        return reportRepository.find(type, status);
    }

    public RegulatoryReport get(String reportId) {
        return reportRepository.findById(reportId)
                .orElseThrow(() -> new ReportNotFoundException(reportId));
    }

    public Optional<String> latestReportId() {
        return reportRepository.findLatest().map(RegulatoryReport::getReportId);
    }

    IncidentsSummary incidentsSummary(Instant start, Instant end) {
        List<Alert> alerts = alertRepository.findAll().stream()
                .filter(a -> TimeUtils.within(a.getTimestamp(), start, end))
                .collect(Collectors.toList());

        Map<String, Long> bySeverity = countBy(alerts, a -> a.getSeverity().getValue());
        return IncidentsSummary.builder()
                .totalAlerts(alerts.size())
                .bySeverity(bySeverity)
                .byType(countBy(alerts, Alert::getAlertType))
                .criticalCount(bySeverity.getOrDefault("critical", 0L))
                .highCount(bySeverity.getOrDefault("high", 0L))
                .build();
    }

    private Map<String, Object> signalsSummary(Instant start, Instant end) {
        List<Signal> signals = signalRepository.findAll().stream()
                .filter(s -> TimeUtils.within(s.getTimestamp(), start, end))
                .collect(Collectors.toList());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_signals", signals.size());
        summary.put("by_type", countBy(signals, s -> s.getSignalType().getValue()));
        summary.put("by_severity", countBy(signals, s -> s.getSeverity().getValue()));
        summary.put("by_status", countBy(signals, s -> s.getStatus().getValue()));
        summary.put("false_positives", signals.stream().filter(s -> s.getStatus() == SignalStatus.FALSE_POSITIVE).count());
        return summary;
    }

    private static String executiveSummary(Map<String, MetricSummary> metrics, IncidentsSummary incidents) {
        return String.join("\n",
                "This report summarizes post-market monitoring activities "
                        + "in accordance with EU AI Act Article 72 requirements.",
                "",
                "Metrics tracked: " + metrics.size(),
                "Total alerts: " + incidents.getTotalAlerts(),
                "Critical incidents: " + incidents.getCriticalCount());
    }

    private static List<String> recommendations(IncidentsSummary incidents, Map<String, Object> signals) {
        List<String> recommendations = new ArrayList<>();
        if (incidents.getCriticalCount() > 0) {
            recommendations.add("Review and address root causes of critical incidents");
        }
        if (incidents.getTotalAlerts() > ALERT_FATIGUE_LIMIT) {
            recommendations.add("Consider adjusting alert thresholds to reduce alert fatigue");
        }
        if (((Number) signals.get("total_signals")).intValue() > 0) {
            recommendations.add("Investigate detected signals and record their disposition");
        }
        recommendations.add("Continue regular monitoring and documentation updates");
        return recommendations;
    }

    private static <T> Map<String, Long> countBy(List<T> items, Function<T, String> key) {
        return items.stream()
                .collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.counting()));
    }
}
