package com.company.reliability.service;

import com.company.reliability.domain.BudgetRatioPoint;
import com.company.reliability.domain.DriftConfig;
import com.company.reliability.domain.DriftMetrics;
import com.company.reliability.domain.DriftProjection;
import com.company.reliability.domain.DriftResult;
import com.company.reliability.domain.enums.DriftPattern;
import com.company.reliability.domain.enums.DriftSeverity;
import com.company.reliability.domain.enums.ServiceTier;
import com.company.reliability.exception.InsufficientDataException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Least-squares trend over a budget-ratio history: slope, fit quality,
 * exhaustion projection, pattern and severity.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DriftAnalyzer {

    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final double SECONDS_PER_WEEK = 604_800.0;
    private static final int MAX_PROJECTION_DAYS = 365;

    private final MeterRegistry meterRegistry;

    public DriftResult analyze(String service, String tier, String sloName, List<BudgetRatioPoint> points) {
        return analyze(service, tier, sloName, points, DriftConfig.forTier(ServiceTier.fromString(tier)));
    }

    public DriftResult analyze(String service, String tier, String sloName, List<BudgetRatioPoint> points,
                               DriftConfig config) {
        if (points == null || points.size() < 2) {
            throw new InsufficientDataException(String.format(
                    "Insufficient data points for %s/%s. Need at least 2 data points, got %d",
                    service, sloName, points == null ? 0 : points.size()));
        }

        List<BudgetRatioPoint> series = points.stream()
                .sorted(Comparator.comparing(BudgetRatioPoint::getTimestamp))
                .collect(Collectors.toList());
        Instant start = series.get(0).getTimestamp();
        Instant end = series.get(series.size() - 1).getTimestamp();

        SimpleRegression regression = new SimpleRegression();
        for (BudgetRatioPoint point : series) {
            regression.addData(Duration.between(start, point.getTimestamp()).toMillis() / 1000.0, point.getRatio());
        }

        double slopePerSecond = regression.getSlope();
        if (Double.isNaN(slopePerSecond)) {
            // every point shares one timestamp
            slopePerSecond = 0.0;
        }
        double rSquared = regression.getRSquare();
        rSquared = Double.isNaN(rSquared) ? 0.0 : Math.max(0.0, Math.min(1.0, rSquared));

        double currentBudget = series.get(series.size() - 1).getRatio();
        DriftMetrics metrics = DriftMetrics.builder()
                .slopePerDay(slopePerSecond * SECONDS_PER_DAY)
                .slopePerWeek(slopePerSecond * SECONDS_PER_WEEK)
                .rSquared(rSquared)
                .currentBudget(currentBudget)
                .budgetAtWindowStart(series.get(0).getRatio())
                .variance(PatternDetector.variance(series))
                .dataPoints(series.size())
                .build();

        Integer daysUntilExhaustion = daysUntilExhaustion(currentBudget, slopePerSecond);
        DriftProjection projection = DriftProjection.builder()
                .daysUntilExhaustion(daysUntilExhaustion)
                .projectedBudget30d(project(currentBudget, metrics.getSlopePerDay(), 30))
                .projectedBudget60d(project(currentBudget, metrics.getSlopePerDay(), 60))
                .projectedBudget90d(project(currentBudget, metrics.getSlopePerDay(), 90))
                .confidence(rSquared)
                .build();

        DriftPattern pattern = new PatternDetector(config.getStepChangeThreshold())
                .detect(series, slopePerSecond, rSquared);
        DriftSeverity severity = classifySeverity(metrics, projection, pattern, config);

        meterRegistry.counter("reliability.drift.analyses",
                "severity", severity.getValue(),
                "pattern", pattern.getValue()
        ).increment();

        log.info("Drift for {}/{}: slope {}%/week, R2 {}, pattern {}, severity {}",
                service, sloName, String.format("%.3f", metrics.getSlopePerWeek() * 100),
                String.format("%.2f", rSquared), pattern.getValue(), severity.getValue());

        return DriftResult.builder()
                .service(service)
                .tier(tier)
                .sloName(sloName)
                .window(config.getWindow())
                .analyzedAt(Instant.now())
                .dataStart(start)
                .dataEnd(end)
                .metrics(metrics)
                .projection(projection)
                .pattern(pattern)
                .severity(severity)
                .summary(summary(metrics, pattern, severity))
                .recommendation(recommendation(metrics, pattern, severity))
                .build();
    }

    Integer daysUntilExhaustion(double currentBudget, double slopePerSecond) {
        if (slopePerSecond >= 0) {
            return null;
        }
        if (currentBudget <= 0) {
            return 0;
        }
        double days = currentBudget / Math.abs(slopePerSecond) / SECONDS_PER_DAY;
        if (days > MAX_PROJECTION_DAYS) {
            return null;
        }
        return (int) days;
    }

    DriftSeverity classifySeverity(DriftMetrics metrics, DriftProjection projection, DriftPattern pattern,
                                   DriftConfig config) {
        Integer exhaustion = projection.getDaysUntilExhaustion();

        if (exhaustion != null && exhaustion <= config.getExhaustionCriticalDays()) {
            return DriftSeverity.CRITICAL;
        }
        if (pattern == DriftPattern.STEP_CHANGE_DOWN) {
            return DriftSeverity.CRITICAL;
        }
        if (metrics.getSlopePerWeek() <= config.getCriticalSlopePerWeek()) {
            return DriftSeverity.CRITICAL;
        }
        if (exhaustion != null && exhaustion <= config.getExhaustionWarnDays()) {
            return DriftSeverity.WARN;
        }
        if (metrics.getSlopePerWeek() <= config.getWarnSlopePerWeek()) {
            return DriftSeverity.WARN;
        }
        if (metrics.getSlopePerWeek() < 0) {
            return DriftSeverity.INFO;
        }
        return DriftSeverity.NONE;
    }

    private double project(double currentBudget, double slopePerDay, int days) {
        return Math.max(0.0, currentBudget + slopePerDay * days);
    }

    private String summary(DriftMetrics metrics, DriftPattern pattern, DriftSeverity severity) {
        double slopePct = Math.abs(metrics.getSlopePerWeek() * 100);
        String direction = metrics.getSlopePerWeek() < 0 ? "declining" : "improving";

        if (severity == DriftSeverity.NONE) {
            return "Error budget is stable with no significant drift detected.";
        }
        if (severity == DriftSeverity.INFO) {
            return String.format("Minor budget drift detected: %s at %.2f%% per week. Fit quality: R2=%.2f",
                    direction, slopePct, metrics.getRSquared());
        }
        if (pattern == DriftPattern.STEP_CHANGE_DOWN) {
            return String.format("Sudden budget drop detected. Budget changed from %.1f%% to %.1f%%.",
                    metrics.getBudgetAtWindowStart() * 100, metrics.getCurrentBudget() * 100);
        }
        String confidence = metrics.getRSquared() > 0.7 ? "high" : "moderate";
        return String.format("Error budget %s at %.2f%% per week with %s confidence (R2=%.2f).",
                direction, slopePct, confidence, metrics.getRSquared());
    }

    private String recommendation(DriftMetrics metrics, DriftPattern pattern, DriftSeverity severity) {
        if (severity == DriftSeverity.NONE) {
            return "No action needed. Continue monitoring.";
        }
        if (severity == DriftSeverity.INFO) {
            return "Monitor for continued decline. Review recent deployments if the trend persists.";
        }
        if (pattern == DriftPattern.STEP_CHANGE_DOWN) {
            return "Investigate the immediate cause of the step change: recent deployments, "
                    + "configuration changes or dependency issues.";
        }
        if (pattern == DriftPattern.VOLATILE) {
            return "High variance suggests intermittent issues. Review error logs for failure patterns "
                    + "and consider adjusting SLO alerting windows.";
        }

        List<String> advice = new ArrayList<>();
        advice.add("Investigate recent changes.");
        advice.add("Common causes: increased traffic, dependency degradation or configuration drift.");
        if (metrics.getRSquared() > 0.7) {
            advice.add("The trend fits well, proactive investigation recommended.");
        }
        return String.join(" ", advice);
    }
}
