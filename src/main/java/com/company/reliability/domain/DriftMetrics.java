package com.company.reliability.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DriftMetrics {
    double slopePerDay;
    double slopePerWeek;
    double rSquared;
    double currentBudget;
    double budgetAtWindowStart;
    double variance;
    int dataPoints;
}
