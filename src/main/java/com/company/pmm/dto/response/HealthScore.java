package com.company.pmm.dto.response;

import com.company.pmm.domain.enums.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthScore {
    private int score;
    private HealthStatus status;
    private int activeSignals;
    private int activeAlerts;
}
