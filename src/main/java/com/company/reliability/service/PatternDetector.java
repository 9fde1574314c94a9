package com.company.reliability.service;

import com.company.reliability.domain.BudgetRatioPoint;
import com.company.reliability.domain.enums.DriftPattern;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.Duration;
import java.util.List;

/**
 * Classifies a budget-ratio series. Step changes win over volatility, which
 * wins over the slope-based patterns.
 */
public class PatternDetector {

    static final double DEFAULT_STEP_CHANGE_THRESHOLD = 0.05;
    static final double VOLATILITY_VARIANCE_THRESHOLD = 0.01;
    static final double VOLATILITY_R_SQUARED_THRESHOLD = 0.3;
    static final double SLOPE_SIGNIFICANCE_PER_WEEK = 0.001;

    private static final Duration STEP_WINDOW = Duration.ofHours(36);

    private final double stepChangeThreshold;

    public PatternDetector() {
        this(DEFAULT_STEP_CHANGE_THRESHOLD);
    }

    public PatternDetector(double stepChangeThreshold) {
        this.stepChangeThreshold = stepChangeThreshold;
    }

    public DriftPattern detect(List<BudgetRatioPoint> points, double slopePerSecond, double rSquared) {
        if (points == null || points.size() < 2) {
            return DriftPattern.STABLE;
        }

        DriftPattern stepChange = detectStepChange(points);
        if (stepChange != null) {
            return stepChange;
        }

        if (rSquared < VOLATILITY_R_SQUARED_THRESHOLD && variance(points) > VOLATILITY_VARIANCE_THRESHOLD) {
            return DriftPattern.VOLATILE;
        }

        double weeklySlope = slopePerSecond * 604_800;
        if (Math.abs(weeklySlope) < SLOPE_SIGNIFICANCE_PER_WEEK) {
            return DriftPattern.STABLE;
        }
        return weeklySlope < 0 ? DriftPattern.GRADUAL_DECLINE : DriftPattern.GRADUAL_IMPROVEMENT;
    }

    static double variance(List<BudgetRatioPoint> points) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        points.forEach(point -> stats.addValue(point.getRatio()));
        return stats.getPopulationVariance();
    }

    private DriftPattern detectStepChange(List<BudgetRatioPoint> points) {
        for (int i = 1; i < points.size(); i++) {
            BudgetRatioPoint previous = points.get(i - 1);
            BudgetRatioPoint current = points.get(i);

            Duration gap = Duration.between(previous.getTimestamp(), current.getTimestamp());
            if (gap.compareTo(STEP_WINDOW) >= 0) {
                continue;
            }

            double diff = current.getRatio() - previous.getRatio();
            if (diff < -stepChangeThreshold) {
                return DriftPattern.STEP_CHANGE_DOWN;
            }
            if (diff > stepChangeThreshold) {
                return DriftPattern.STEP_CHANGE_UP;
            }
        }
        return null;
    }
}
