package com.company.pmm.domain;

import com.company.pmm.domain.enums.MetricDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Target / alert / critical thresholds for one metric, bound from {@code pmm.bands}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricBand {
    private Double target;
    private Double alertThreshold;
    private Double criticalThreshold;

    @Builder.Default
    private MetricDirection direction = MetricDirection.HIGHER_IS_BETTER;
}
