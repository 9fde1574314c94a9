package com.company.reliability.domain.enums;

/**
 * Confidence bands for deployment burn attribution.
 */
public enum ConfidenceLevel {
    HIGH(0.7),
    MEDIUM(0.5),
    LOW(0.3),
    NONE(0.0);

    private final double floor;

    ConfidenceLevel(double floor) {
        this.floor = floor;
    }

    public double getFloor() {
        return floor;
    }

    public static ConfidenceLevel fromConfidence(double confidence) {
        if (confidence >= HIGH.floor) {
            return HIGH;
        }
        if (confidence >= MEDIUM.floor) {
            return MEDIUM;
        }
        if (confidence >= LOW.floor) {
            return LOW;
        }
        return NONE;
    }
}
