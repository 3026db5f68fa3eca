package com.company.pmm.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentsSummary {
    private long totalAlerts;
    private Map<String, Long> bySeverity;
    private Map<String, Long> byType;
    private long criticalCount;
    private long highCount;
}
