package com.company.reliability.domain;

import com.company.reliability.domain.enums.SloStatus;
import com.company.reliability.util.TimeUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Error budget for one SLO over one period. One logical record per
 * (sloId, periodStart, periodEnd); re-evaluation upserts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorBudget {
    private String sloId;
    private String service;
    private Instant periodStart;
    private Instant periodEnd;
    private double totalBudgetMinutes;
    private double burnedMinutes;
    private double remainingMinutes;

    @Builder.Default
    private double incidentBurnMinutes = 0.0;
    @Builder.Default
    private double deploymentBurnMinutes = 0.0;
    @Builder.Default
    private double sloBreachBurnMinutes = 0.0;

    private SloStatus status;
    /** Budget minutes consumed per wall-clock minute. */
    private Double burnRate;
    private Instant updatedAt;

    public static double remainingOf(double total, double burned) {
        return Math.max(0.0, total - burned);
    }

    public double getPercentConsumed() {
        if (totalBudgetMinutes == 0.0) {
            return 0.0;
        }
        return burnedMinutes / totalBudgetMinutes * 100.0;
    }

    public double getPercentRemaining() {
        return 100.0 - getPercentConsumed();
    }

    /**
     * Burn rate that would exactly spend the budget by the end of the period.
     */
    public double getBaselineBurnRate() {
        double periodMinutes = TimeUtils.minutesBetween(periodStart, periodEnd);
        if (periodMinutes <= 0.0) {
            return 0.0;
        }
        return totalBudgetMinutes / periodMinutes;
    }

    public double getBurnRateMultiple() {
        double baseline = getBaselineBurnRate();
        if (burnRate == null || baseline <= 0.0) {
            return 0.0;
        }
        return burnRate / baseline;
    }
}
