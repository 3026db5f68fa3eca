package com.company.pmm.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportGenerateRequest {
    @Builder.Default
    private String reportType = "periodic";

    @Builder.Default
    @Min(1)
    @Max(365)
    private int periodDays = 30;
}
