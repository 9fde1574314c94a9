package com.company.reliability.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity {
    INFO("info", Severity.INFO),
    WARNING("warning", Severity.WARNING),
    CRITICAL("critical", Severity.CRITICAL);

    private final String value;
    private final Severity severity;

    AlertSeverity(String value, Severity severity) {
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

    @JsonCreator
    public static AlertSeverity fromString(String severity) {
        if (severity == null) {
            return WARNING;
        }
        for (AlertSeverity candidate : values()) {
            if (candidate.value.equalsIgnoreCase(severity.trim())) {
                return candidate;
            }
        }
        return WARNING;
    }
}
