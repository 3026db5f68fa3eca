package com.company.pmm.dto.response;

import com.company.pmm.domain.enums.SlaStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaStatusResponse {
    private SlaStatus status;
    private double periodHours;
    private Map<String, DimensionResult> metrics;
    private List<Breach> breaches;
    private int samples;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DimensionResult {
        private double value;
        private double target;
        private boolean compliant;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Breach {
        private String dimension;
        private double actual;
        private double target;
    }
}
