package com.company.reliability.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetRatioPoint {
    private Instant timestamp;
    private double ratio;

    public static BudgetRatioPoint of(Instant timestamp, double ratio) {
        return new BudgetRatioPoint(timestamp, ratio);
    }
}
