package com.company.reliability.domain.enums;

/**
 * Kinds of alert rule. Anything unrecognised maps to {@link #UNKNOWN},
 * which never fires.
 */
public enum AlertType {
    BUDGET_THRESHOLD("Fires when consumed budget reaches a fraction of the total"),
    BURN_RATE("Fires when burn rate reaches a multiple of the sustainable rate"),
    BUDGET_EXHAUSTION("Fires when projected exhaustion is within a number of hours"),
    UNKNOWN("Unrecognised rule type, inert");

    private final String description;

    AlertType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static AlertType fromString(String type) {
        if (type == null) {
            return UNKNOWN;
        }
        try {
            return AlertType.valueOf(type.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
