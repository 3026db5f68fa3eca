package com.company.pmm.exception;

/**
 * Raised when a record is asked to leave a final status.
 */
public class InvalidStatusTransitionException extends RuntimeException {
    public InvalidStatusTransitionException(String recordId, String from, String to) {
        super(String.format("Cannot move %s from %s to %s", recordId, from, to));
    }
}
