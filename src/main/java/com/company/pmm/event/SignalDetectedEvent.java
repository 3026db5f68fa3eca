package com.company.pmm.event;

import com.company.pmm.domain.Signal;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SignalDetectedEvent {
    private final Signal signal;
}
