package com.company.pmm.dto.response;

import com.company.pmm.domain.Signal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRunResponse {
    private Instant timestamp;
    private int metricsScanned;
    private int signalsDetected;
    private List<Signal> signals;
}
