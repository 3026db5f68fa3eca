package com.company.pmm.repository;

import com.company.pmm.domain.RegulatoryReport;
import com.company.pmm.domain.enums.ReportStatus;
import com.company.pmm.domain.enums.ReportType;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Generated reports in creation order. Reports are written rarely and listed often.
 */
@Repository
public class RegulatoryReportRepository {

    private final List<RegulatoryReport> reports = new CopyOnWriteArrayList<>();

    public RegulatoryReport save(RegulatoryReport report) {
        reports.add(report);
        return report;
    }

    public Optional<RegulatoryReport> findById(String reportId) {
        return reports.stream()
                .filter(report -> report.getReportId().equals(reportId))
                .findFirst();
    }

    public List<RegulatoryReport> find(ReportType type, ReportStatus status) {
        return reports.stream()
                .filter(report -> type == null || report.getReportType() == type)
                .filter(report -> status == null || report.getStatus() == status)
                .collect(Collectors.toList());
    }

    public Optional<RegulatoryReport> findLatest() {
        return reports.isEmpty() ? Optional.empty() : Optional.of(reports.get(reports.size() - 1));
    }
}
