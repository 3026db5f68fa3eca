package com.company.pmm.dto.response;

import com.company.pmm.domain.Signal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignalListResponse {
    private int count;
    private List<Signal> signals;

    public static SignalListResponse of(List<Signal> signals) {
        return new SignalListResponse(signals.size(), signals);
    }
}
