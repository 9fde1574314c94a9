package com.company.reliability.service;

import com.company.reliability.domain.BudgetRatioPoint;
import com.company.reliability.domain.DriftConfig;
import com.company.reliability.domain.DriftResult;
import com.company.reliability.domain.enums.DriftPattern;
import com.company.reliability.domain.enums.DriftSeverity;
import com.company.reliability.domain.enums.ServiceTier;
import com.company.reliability.exception.InsufficientDataException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("DriftAnalyzer")
class DriftAnalyzerTest {

    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");

    private DriftAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new DriftAnalyzer(new SimpleMeterRegistry());
    }

    private List<BudgetRatioPoint> linear(double startRatio, double perDay, int days) {
        List<BudgetRatioPoint> points = new ArrayList<>();
        for (int day = 0; day <= days; day++) {
            points.add(BudgetRatioPoint.of(START.plus(Duration.ofDays(day)), startRatio + perDay * day));
        }
        return points;
    }

    @Test
    @DisplayName("Should report a flat series as stable")
    void shouldReportStable() {
        DriftResult result = analyzer.analyze("checkout", "standard", "availability", linear(0.9, 0.0, 20));

        assertThat(result.getPattern()).isEqualTo(DriftPattern.STABLE);
        assertThat(result.getSeverity()).isEqualTo(DriftSeverity.NONE);
        assertThat(result.getProjection().getDaysUntilExhaustion()).isNull();
        assertThat(result.getExitCode()).isZero();
        assertThat(result.getSummary()).contains("stable");
    }

    @Test
    @DisplayName("Should measure a steady decline")
    void shouldMeasureDecline() {
        // Given: losing 0.2% of budget a day, 1.4% a week
        DriftResult result = analyzer.analyze("checkout", "standard", "availability", linear(0.9, -0.002, 20));

        // Then
        assertThat(result.getMetrics().getSlopePerDay()).isCloseTo(-0.002, within(1e-9));
        assertThat(result.getMetrics().getSlopePerWeek()).isCloseTo(-0.014, within(1e-9));
        assertThat(result.getMetrics().getRSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getPattern()).isEqualTo(DriftPattern.GRADUAL_DECLINE);
        assertThat(result.getSeverity()).isEqualTo(DriftSeverity.CRITICAL);
        assertThat(result.getProjection().getProjectedBudget30d()).isCloseTo(0.86 - 0.06, within(1e-9));
        assertThat(result.getExitCode()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should project sooner exhaustion for a steeper decline")
    void shouldProjectSoonerForSteeperDecline() {
        DriftResult gentle = analyzer.analyze("svc", "standard", "slo", linear(0.9, -0.005, 14));
        DriftResult steep = analyzer.analyze("svc", "standard", "slo", linear(0.9, -0.01, 14));

        assertThat(steep.getProjection().getDaysUntilExhaustion())
                .isLessThan(gentle.getProjection().getDaysUntilExhaustion());
    }

    @Test
    @DisplayName("Should flag a sudden drop as a critical step change")
    void shouldFlagStepChange() {
        List<BudgetRatioPoint> points = linear(0.9, 0.0, 10);
        points.add(BudgetRatioPoint.of(START.plus(Duration.ofDays(10)).plus(Duration.ofHours(12)), 0.7));

        DriftResult result = analyzer.analyze("checkout", "standard", "availability", points);

        assertThat(result.getPattern()).isEqualTo(DriftPattern.STEP_CHANGE_DOWN);
        assertThat(result.getSeverity()).isEqualTo(DriftSeverity.CRITICAL);
        assertThat(result.getSummary()).startsWith("Sudden budget drop detected");
    }

    @Test
    @DisplayName("Should honour tier thresholds")
    void shouldHonourTierThresholds() {
        // Given: 0.3% per week decline warns for critical services only
        List<BudgetRatioPoint> points = linear(0.9, -0.003 / 7, 28);

        DriftResult critical = analyzer.analyze("svc", "critical", "slo", points);
        DriftResult standard = analyzer.analyze("svc", "standard", "slo", points);

        assertThat(critical.getSeverity()).isEqualTo(DriftSeverity.WARN);
        assertThat(standard.getSeverity()).isEqualTo(DriftSeverity.INFO);
    }

    @Test
    @DisplayName("Should accept overridden thresholds")
    void shouldAcceptOverriddenThresholds() {
        DriftConfig relaxed = DriftConfig.forTier(ServiceTier.STANDARD).toBuilder()
                .warnSlopePerWeek(DriftConfig.parseSlopeThreshold("-5%/week"))
                .criticalSlopePerWeek(DriftConfig.parseSlopeThreshold("-10%/week"))
                .exhaustionWarnDays(1)
                .exhaustionCriticalDays(0)
                .build();

        DriftResult result = analyzer.analyze("svc", "standard", "slo", linear(0.9, -0.002, 20), relaxed);

        assertThat(result.getSeverity()).isEqualTo(DriftSeverity.INFO);
    }

    @Test
    @DisplayName("Should require at least two points")
    void shouldRequireTwoPoints() {
        List<BudgetRatioPoint> single = List.of(BudgetRatioPoint.of(START, 0.9));

        assertThatThrownBy(() -> analyzer.analyze("checkout", "standard", "availability", single))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("got 1");
        assertThatThrownBy(() -> analyzer.analyze("checkout", "standard", "availability", null))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    @DisplayName("Should report zero days left for an empty budget")
    void shouldReportZeroDaysForEmptyBudget() {
        assertThat(analyzer.daysUntilExhaustion(0.0, -1e-7)).isZero();
        assertThat(analyzer.daysUntilExhaustion(0.5, 0.0)).isNull();
    }
}
