package com.company.reliability.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DriftPattern {
    STABLE("stable"),
    GRADUAL_DECLINE("gradual_decline"),
    GRADUAL_IMPROVEMENT("gradual_improvement"),
    STEP_CHANGE_DOWN("step_change_down"),
    STEP_CHANGE_UP("step_change_up"),
    VOLATILE("volatile");

    private final String value;

    DriftPattern(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
