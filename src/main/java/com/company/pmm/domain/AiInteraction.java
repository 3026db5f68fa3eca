package com.company.pmm.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One logged exchange with the monitored AI system.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiInteraction {
    private String interactionId;
    private Instant timestamp;
    private String userId;
    private String prompt;
    private String response;
    private double responseTime; // seconds
    private String modelVersion;

    // Free-form scalar maps; fields are only checked where an algorithm needs them
    private Map<String, Object> metadata;
    private Map<String, Object> demographics;

    // Upstream-evaluated quality metrics, e.g. response_accuracy
    private Map<String, Double> metrics;
}
