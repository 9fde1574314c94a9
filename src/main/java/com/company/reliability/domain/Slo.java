package com.company.reliability.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Service Level Objective. Immutable; use {@code toBuilder()} for an
 * explicit update. Targets above 1 are read as percentages.
 */
@Value
@Builder(toBuilder = true)
public class Slo {
    String id;
    String service;
    String name;
    String description;
    double target;
    TimeWindow timeWindow;
    String query;
    String owner;
    @Singular
    Map<String, String> labels;

    public double getErrorBudgetFraction() {
        return 1.0 - target;
    }

    public static double normalizeTarget(double target) {
        return target > 1.0 ? target / 100.0 : target;
    }

    public static class SloBuilder {
        public SloBuilder target(double target) {
            this.target = normalizeTarget(target);
            return this;
        }
    }
}
