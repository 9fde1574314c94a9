package com.company.reliability.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DeliveryStatus {
    SENT("sent"),
    SKIPPED("skipped"),
    FAILED("failed");

    private final String value;

    DeliveryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
