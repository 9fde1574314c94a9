package com.company.reliability.domain.enums;

import java.util.Collection;

/**
 * Engine-wide severity order shared by alert, drift and gate outcomes.
 * Exit codes follow the CI convention: 0 healthy, 1 warning, 2 critical.
 */
public enum Severity {
    NONE(0, 0, "healthy"),
    INFO(1, 0, "info"),
    WARNING(2, 1, "warning"),
    CRITICAL(3, 2, "critical");

    private final int level;
    private final int exitCode;
    private final String label;

    Severity(int level, int exitCode, String label) {
        this.level = level;
        this.exitCode = exitCode;
        this.label = label;
    }

    public int getLevel() {
        return level;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getLabel() {
        return label;
    }

    public boolean isHigherThan(Severity other) {
        return this.level > other.level;
    }

    public static Severity worstOf(Collection<Severity> severities) {
        Severity worst = NONE;
        if (severities == null) {
            return worst;
        }
        for (Severity severity : severities) {
            if (severity != null && severity.isHigherThan(worst)) {
                worst = severity;
            }
        }
        return worst;
    }

    public static Severity fromString(String severity) {
        if (severity == null) {
            return NONE;
        }
        String normalized = severity.trim().toUpperCase();
        if ("WARN".equals(normalized)) {
            return WARNING;
        }
        if ("HEALTHY".equals(normalized)) {
            return NONE;
        }
        try {
            return Severity.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
