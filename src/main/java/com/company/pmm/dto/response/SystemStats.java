package com.company.pmm.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStats {
    private Instant timestamp;
    private long totalInteractions;
    @JsonProperty("interactions_24h")
    private long interactions24h;
    private long totalFeedback;
    private long totalAlerts;
    private long activeAlerts;
    private long totalSignals;
    private long activeSignals;
    private int metricsTracked;
}
