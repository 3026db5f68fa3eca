package com.company.pmm.exception;

public class SignalNotFoundException extends RuntimeException {
    public SignalNotFoundException(String signalId) {
        super("Signal not found: " + signalId);
    }
}
