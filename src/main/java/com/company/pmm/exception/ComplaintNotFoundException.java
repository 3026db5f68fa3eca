package com.company.pmm.exception;

public class ComplaintNotFoundException extends RuntimeException {
    public ComplaintNotFoundException(String complaintId) {
        super("Complaint not found: " + complaintId);
    }
}
