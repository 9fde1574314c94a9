package com.company.reliability.domain.enums;

public enum SloStatus {
    HEALTHY,
    WARNING,
    CRITICAL,
    EXHAUSTED;

    /**
     * Status bands over percent consumed. NaN fails every comparison and
     * lands on HEALTHY.
     */
    public static SloStatus fromPercentConsumed(double percentConsumed) {
        if (percentConsumed >= 100.0) {
            return EXHAUSTED;
        }
        if (percentConsumed >= 80.0) {
            return CRITICAL;
        }
        if (percentConsumed >= 50.0) {
            return WARNING;
        }
        return HEALTHY;
    }

    public static SloStatus fromString(String status) {
        if (status == null) {
            return HEALTHY;
        }
        try {
            return SloStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return HEALTHY;
        }
    }
}
