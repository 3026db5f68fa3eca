package com.company.pmm.dto.response;

import com.company.pmm.domain.RegulatoryReport;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReportListResponse {
    private int count;
    private List<RegulatoryReport> reports;

    public static ReportListResponse of(List<RegulatoryReport> reports) {
        return new ReportListResponse(reports.size(), reports);
    }
}
