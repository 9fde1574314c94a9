package com.company.reliability.domain.enums;

public enum TimeWindowType {
    ROLLING,
    CALENDAR;

    public static TimeWindowType fromString(String type) {
        if (type == null) {
            return ROLLING;
        }
        try {
            return TimeWindowType.valueOf(type.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return ROLLING;
        }
    }
}
