package com.company.pmm.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsQueryRequest {
    // Empty means every tracked metric
    @Builder.Default
    private List<String> metricNames = new ArrayList<>();

    @Builder.Default
    @Min(1)
    @Max(24 * 30)
    private int hours = 24;
}
