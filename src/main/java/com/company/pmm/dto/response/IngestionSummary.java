package com.company.pmm.dto.response;

import com.company.pmm.domain.Alert;
import com.company.pmm.domain.Signal;
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
public class IngestionSummary {
    private String status;
    private String id;
    private int metricsRecorded;

    @Builder.Default
    private List<Alert> alertsTriggered = new ArrayList<>();

    @Builder.Default
    private List<Signal> signalsDetected = new ArrayList<>();
}
