package com.company.pmm.event;

import com.company.pmm.domain.Alert;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AlertRaisedEvent {
    private final Alert alert;
}
