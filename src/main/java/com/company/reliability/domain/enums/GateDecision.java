package com.company.reliability.domain.enums;

public enum GateDecision {
    APPROVED(Severity.NONE),
    WARNING(Severity.WARNING),
    BLOCKED(Severity.CRITICAL);

    private final Severity severity;

    GateDecision(Severity severity) {
        this.severity = severity;
    }

    public Severity toSeverity() {
        return severity;
    }

    public int getExitCode() {
        return severity.getExitCode();
    }
}
