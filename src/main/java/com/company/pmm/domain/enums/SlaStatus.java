package com.company.pmm.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SlaStatus {
    COMPLIANT,
    BREACH,
    NO_DATA;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
