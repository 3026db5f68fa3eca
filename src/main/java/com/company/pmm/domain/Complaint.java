package com.company.pmm.domain;

import com.company.pmm.domain.enums.ComplaintPriority;
import com.company.pmm.domain.enums.ComplaintStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * User complaint with its audit trail. Invariant: resolvedAt != null iff status is resolved or closed.
 * Immutable; tags and updates are unmodifiable lists, changes go through {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Complaint {
    String complaintId;
    Instant createdAt;
    String userId;
    String category;
    String subject;
    String description;
    ComplaintPriority priority;

    @Builder.Default
    ComplaintStatus status = ComplaintStatus.OPEN;

    String assignedTo;
    String relatedInteractionId;
    String resolution;
    Instant resolvedAt;

    @Builder.Default
    List<String> tags = List.of();

    @Builder.Default
    List<ComplaintUpdate> updates = List.of();

    @JsonIgnore
    public boolean isOpen() {
        return status != null && !status.isTerminal();
    }
}
