package com.company.pmm.dto.response;

import com.company.pmm.domain.Alert;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertListResponse {
    private int count;
    private List<Alert> alerts;

    public static AlertListResponse of(List<Alert> alerts) {
        return new AlertListResponse(alerts.size(), alerts);
    }
}
