package com.company.reliability.service;

import com.company.reliability.domain.AlertEvent;
import com.company.reliability.domain.AlertRule;
import com.company.reliability.domain.ErrorBudget;
import com.company.reliability.domain.enums.AlertSeverity;
import com.company.reliability.domain.enums.AlertType;
import com.company.reliability.domain.enums.SloStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("AlertEvaluator")
class AlertEvaluatorTest {

    private static final Instant END = Instant.parse("2024-06-30T00:00:00Z");
    // 30 days at 99.9%: 43.2 budget minutes, sustainable rate 0.001 per minute
    private static final double TOTAL = 43.2;
    private static final double BASELINE_RATE = 0.001;

    private AlertEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new AlertEvaluator();
    }

    private ErrorBudget budget(double burned, Double burnRate) {
        return ErrorBudget.builder()
                .sloId("checkout-availability")
                .service("checkout")
                .periodStart(END.minus(Duration.ofDays(30)))
                .periodEnd(END)
                .totalBudgetMinutes(TOTAL)
                .burnedMinutes(burned)
                .remainingMinutes(ErrorBudget.remainingOf(TOTAL, burned))
                .status(SloStatus.fromPercentConsumed(burned / TOTAL * 100))
                .burnRate(burnRate)
                .build();
    }

    private AlertRule rule(String name, AlertType type, double threshold, AlertSeverity severity) {
        return AlertRule.builder()
                .id("checkout-" + name)
                .name(name)
                .service("checkout")
                .sloId("checkout-availability")
                .alertType(type)
                .threshold(threshold)
                .severity(severity)
                .build();
    }

    @Nested
    @DisplayName("Budget threshold")
    class BudgetThreshold {

        @Test
        @DisplayName("Should fire when consumption reaches the threshold")
        void shouldFireAtThreshold() {
            // Given: 80% consumed
            ErrorBudget budget = budget(TOTAL * 0.8, null);
            AlertRule rule = rule("budget-warning", AlertType.BUDGET_THRESHOLD, 0.8, AlertSeverity.WARNING);

            // When
            List<AlertEvent> events = evaluator.evaluateRules(budget, List.of(rule));

            // Then
            assertThat(events).hasSize(1);
            AlertEvent event = events.get(0);
            assertThat(event.getTitle()).isEqualTo("Error Budget Alert: checkout");
            assertThat(event.getSeverity()).isEqualTo(AlertSeverity.WARNING);
            assertThat(event.getRuleId()).isEqualTo("checkout-budget-warning");
            assertThat(event.getId()).startsWith("alert-checkout-");
            assertThat(event.getDetails()).containsKeys("burned_minutes", "remaining_minutes",
                    "total_budget_minutes", "burn_rate", "status", "budget_consumed_percent");
        }

        @Test
        @DisplayName("Should stay silent below the threshold")
        void shouldStaySilentBelowThreshold() {
            ErrorBudget budget = budget(TOTAL * 0.5, null);
            AlertRule rule = rule("budget-warning", AlertType.BUDGET_THRESHOLD, 0.8, AlertSeverity.WARNING);

            assertThat(evaluator.evaluateRules(budget, List.of(rule))).isEmpty();
        }

        @Test
        @DisplayName("Should never fire on NaN consumption")
        void shouldIgnoreNaN() {
            ErrorBudget budget = budget(Double.NaN, null);
            AlertRule rule = rule("budget-warning", AlertType.BUDGET_THRESHOLD, 0.0, AlertSeverity.WARNING);

            assertThat(evaluator.evaluateRules(budget, List.of(rule))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Burn rate")
    class BurnRate {

        @Test
        @DisplayName("Should fire when the multiple of the sustainable rate meets the threshold")
        void shouldFireOnMultiple() {
            // Given: burning six times faster than sustainable
            ErrorBudget budget = budget(5.0, BASELINE_RATE * 6);
            AlertRule rule = rule("burn-rate-warning", AlertType.BURN_RATE, 5.0, AlertSeverity.WARNING);

            // When
            List<AlertEvent> events = evaluator.evaluateRules(budget, List.of(rule));

            // Then
            assertThat(events).hasSize(1);
            assertThat(events.get(0).getTitle()).isEqualTo("High Burn Rate Alert: checkout");
            assertThat((Double) events.get(0).getDetails().get("burn_rate_multiple")).isGreaterThanOrEqualTo(5.0);
        }

        @Test
        @DisplayName("Should not fire without a burn rate")
        void shouldNotFireWithoutRate() {
            AlertRule rule = rule("burn-rate-warning", AlertType.BURN_RATE, 1.0, AlertSeverity.WARNING);

            assertThat(evaluator.evaluateRules(budget(5.0, null), List.of(rule))).isEmpty();
            assertThat(evaluator.evaluateRules(budget(5.0, 0.0), List.of(rule))).isEmpty();
            assertThat(evaluator.evaluateRules(budget(5.0, Double.NaN), List.of(rule))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Budget exhaustion")
    class BudgetExhaustion {

        @Test
        @DisplayName("Should fire when the budget runs out within the threshold hours")
        void shouldFireWithinHorizon() {
            // Given: 6 minutes left burning 0.01 per minute is 10 hours
            ErrorBudget budget = budget(TOTAL - 6.0, 0.01);
            AlertRule rule = rule("budget-exhaustion", AlertType.BUDGET_EXHAUSTION, 12.0, AlertSeverity.CRITICAL);

            // When
            List<AlertEvent> events = evaluator.evaluateRules(budget, List.of(rule));

            // Then
            assertThat(events).hasSize(1);
            assertThat(events.get(0).getTitle()).isEqualTo("Budget Exhaustion Alert: checkout");
            assertThat((Double) events.get(0).getDetails().get("hours_until_exhaustion"))
                    .isCloseTo(10.0, within(1e-6));
        }

        @Test
        @DisplayName("Should stay silent when exhaustion is further away")
        void shouldStaySilentBeyondHorizon() {
            ErrorBudget budget = budget(TOTAL - 6.0, 0.01);
            AlertRule rule = rule("budget-exhaustion", AlertType.BUDGET_EXHAUSTION, 6.0, AlertSeverity.CRITICAL);

            assertThat(evaluator.evaluateRules(budget, List.of(rule))).isEmpty();
        }
    }

    @Test
    @DisplayName("Should skip disabled, foreign and unknown rules")
    void shouldSkipInapplicableRules() {
        // Given
        ErrorBudget budget = budget(TOTAL, BASELINE_RATE * 10);
        AlertRule disabled = rule("disabled", AlertType.BUDGET_THRESHOLD, 0.1, AlertSeverity.WARNING)
                .toBuilder().enabled(false).build();
        AlertRule otherSlo = rule("other", AlertType.BUDGET_THRESHOLD, 0.1, AlertSeverity.WARNING)
                .toBuilder().sloId("checkout-latency").build();
        AlertRule otherService = rule("foreign", AlertType.BUDGET_THRESHOLD, 0.1, AlertSeverity.WARNING)
                .toBuilder().service("payments").build();
        AlertRule unknown = rule("unknown", AlertType.UNKNOWN, 0.1, AlertSeverity.WARNING);
        AlertRule wildcard = rule("wildcard", AlertType.BUDGET_THRESHOLD, 0.1, AlertSeverity.CRITICAL)
                .toBuilder().sloId(AlertRule.ALL_SLOS).build();

        // When
        List<AlertEvent> events = evaluator.evaluateRules(budget,
                List.of(disabled, otherSlo, otherService, unknown, wildcard));

        // Then
        assertThat(events).extracting(AlertEvent::getRuleId).containsExactly("checkout-wildcard");
    }

    @Test
    @DisplayName("Should keep rule order across firing rules")
    void shouldKeepRuleOrder() {
        ErrorBudget budget = budget(TOTAL * 0.95, BASELINE_RATE * 6);
        List<AlertRule> rules = List.of(
                rule("budget-critical", AlertType.BUDGET_THRESHOLD, 0.9, AlertSeverity.CRITICAL),
                rule("burn-rate-warning", AlertType.BURN_RATE, 3.0, AlertSeverity.WARNING),
                rule("budget-warning", AlertType.BUDGET_THRESHOLD, 0.75, AlertSeverity.WARNING));

        assertThat(evaluator.evaluateRules(budget, rules))
                .extracting(AlertEvent::getRuleId)
                .containsExactly("checkout-budget-critical", "checkout-burn-rate-warning", "checkout-budget-warning");
    }
}
