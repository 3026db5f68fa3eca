package com.company.pmm.dto.response;

import com.company.pmm.domain.PerformanceSnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotHistoryResponse {
    private int hours;
    private int count;
    private List<PerformanceSnapshot> snapshots;
}
