package com.company.reliability.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DriftSeverity {
    NONE("none", Severity.NONE),
    INFO("info", Severity.INFO),
    WARN("warn", Severity.WARNING),
    CRITICAL("critical", Severity.CRITICAL);

    private final String value;
    private final Severity severity;

    DriftSeverity(String value, Severity severity) {
        this.value = value;
        this.severity = severity;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Severity toSeverity() {
        return severity;
    }

    public int getExitCode() {
        return severity.getExitCode();
    }
}
