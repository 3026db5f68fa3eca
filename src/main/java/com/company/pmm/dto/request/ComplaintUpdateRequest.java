package com.company.pmm.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplaintUpdateRequest {
    private String status;
    private String priority;
    private String assignedTo;
    private String resolution;
    private String updatedBy;
}
