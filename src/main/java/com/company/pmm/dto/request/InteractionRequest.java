package com.company.pmm.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionRequest {
    @NotBlank(message = "Interaction ID is required")
    private String interactionId;

    private String userId;

    @NotBlank(message = "Prompt is required")
    private String prompt;

    @NotBlank(message = "Response is required")
    private String response;

    @NotNull(message = "Response time is required")
    @PositiveOrZero
    private Double responseTime; // seconds

    private String modelVersion;

    // Defaults to the time of receipt
    private Instant timestamp;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @Builder.Default
    private Map<String, Object> demographics = new HashMap<>();

    // Metric values evaluated upstream, e.g. response_accuracy, hallucination_rate
    @Builder.Default
    private Map<String, Double> metrics = new HashMap<>();
}
