package com.company.pmm.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Audit entry appended on every effective complaint update.
 */
@Value
@Builder
@Jacksonized
public class ComplaintUpdate {
    Instant timestamp;
    String updatedBy;
    Map<String, FieldChange> changes;

    @Value
    public static class FieldChange {
        String from;
        String to;
    }
}
