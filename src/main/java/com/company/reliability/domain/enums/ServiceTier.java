package com.company.reliability.domain.enums;

/**
 * Service criticality tier. Unknown tiers resolve to STANDARD.
 */
public enum ServiceTier {
    CRITICAL("critical"),
    HIGH("high"),
    STANDARD("standard"),
    LOW("low");

    private final String value;

    ServiceTier(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ServiceTier fromString(String tier) {
        if (tier == null) {
            return STANDARD;
        }
        for (ServiceTier candidate : values()) {
            if (candidate.value.equalsIgnoreCase(tier.trim())) {
                return candidate;
            }
        }
        return STANDARD;
    }
}
