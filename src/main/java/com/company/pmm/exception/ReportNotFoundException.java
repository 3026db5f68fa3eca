package com.company.pmm.exception;

public class ReportNotFoundException extends RuntimeException {
    public ReportNotFoundException(String reportId) {
        super("Report not found: " + reportId);
    }
}
