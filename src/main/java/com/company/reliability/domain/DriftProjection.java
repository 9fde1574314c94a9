package com.company.reliability.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DriftProjection {
    /** Null when the budget is not declining or exhaustion is over a year out. */
    Integer daysUntilExhaustion;
    double projectedBudget30d;
    double projectedBudget60d;
    double projectedBudget90d;
    double confidence;
}
