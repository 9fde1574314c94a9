package com.company.reliability.domain;

import com.company.reliability.domain.enums.ServiceTier;
import lombok.Builder;
import lombok.Value;

/**
 * Drift thresholds. Slope thresholds are budget fractions per week, so
 * -0.005 reads as "losing half a percent of budget per week".
 */
@Value
@Builder(toBuilder = true)
public class DriftConfig {
    String window;
    double warnSlopePerWeek;
    double criticalSlopePerWeek;
    int exhaustionWarnDays;
    int exhaustionCriticalDays;
    double stepChangeThreshold;
    String projectionHorizon;
    boolean enabled;

    public static DriftConfig forTier(ServiceTier tier) {
        if (tier == ServiceTier.CRITICAL) {
            return DriftConfig.builder()
                    .window("30d")
                    .warnSlopePerWeek(-0.002)
                    .criticalSlopePerWeek(-0.005)
                    .exhaustionWarnDays(30)
                    .exhaustionCriticalDays(14)
                    .stepChangeThreshold(0.05)
                    .projectionHorizon("90d")
                    .enabled(true)
                    .build();
        }
        if (tier == ServiceTier.LOW) {
            return DriftConfig.builder()
                    .window("14d")
                    .warnSlopePerWeek(-0.01)
                    .criticalSlopePerWeek(-0.02)
                    .exhaustionWarnDays(7)
                    .exhaustionCriticalDays(3)
                    .stepChangeThreshold(0.10)
                    .projectionHorizon("30d")
                    .enabled(false)
                    .build();
        }
        return DriftConfig.builder()
                .window("30d")
                .warnSlopePerWeek(-0.005)
                .criticalSlopePerWeek(-0.01)
                .exhaustionWarnDays(14)
                .exhaustionCriticalDays(7)
                .stepChangeThreshold(0.05)
                .projectionHorizon("60d")
                .enabled(true)
                .build();
    }

    /**
     * Reads thresholds written as {@code -0.5%/week} or {@code -0.005}.
     */
    public static double parseSlopeThreshold(String threshold) {
        String cleaned = threshold.trim().toLowerCase().replace("/week", "").trim();
        if (cleaned.endsWith("%")) {
            return Double.parseDouble(cleaned.substring(0, cleaned.length() - 1)) / 100.0;
        }
        return Double.parseDouble(cleaned);
    }
}
