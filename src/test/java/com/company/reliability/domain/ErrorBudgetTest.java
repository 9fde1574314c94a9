package com.company.reliability.domain;

import com.company.reliability.domain.enums.SloStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ErrorBudget")
class ErrorBudgetTest {

    private static final Instant END = Instant.parse("2024-06-30T00:00:00Z");

    @ParameterizedTest(name = "{0}% consumed is {1}")
    @CsvSource({
            "0, HEALTHY",
            "49.9, HEALTHY",
            "50, WARNING",
            "80, CRITICAL",
            "100, EXHAUSTED",
            "250, EXHAUSTED",
            "NaN, HEALTHY"
    })
    void shouldDeriveStatus(double percentConsumed, SloStatus expected) {
        assertThat(SloStatus.fromPercentConsumed(percentConsumed)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should treat an empty budget as unconsumed")
    void shouldHandleZeroBudget() {
        ErrorBudget budget = ErrorBudget.builder().totalBudgetMinutes(0.0).burnedMinutes(5.0).build();

        assertThat(budget.getPercentConsumed()).isZero();
        assertThat(budget.getPercentRemaining()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Should express burn rate as a multiple of the sustainable rate")
    void shouldComputeBurnRateMultiple() {
        ErrorBudget budget = ErrorBudget.builder()
                .periodStart(END.minus(Duration.ofDays(1)))
                .periodEnd(END)
                .totalBudgetMinutes(14.4)
                .burnRate(0.02)
                .build();

        assertThat(budget.getBaselineBurnRate()).isCloseTo(0.01, within(1e-12));
        assertThat(budget.getBurnRateMultiple()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    @DisplayName("Should never report negative remaining budget")
    void shouldClampRemaining() {
        assertThat(ErrorBudget.remainingOf(10.0, 15.0)).isZero();
        assertThat(ErrorBudget.remainingOf(10.0, 4.0)).isEqualTo(6.0);
    }

    @Test
    @DisplayName("Should normalise percentage targets")
    void shouldNormaliseTargets() {
        Slo percent = Slo.builder().id("a").target(99.9).build();
        Slo fraction = Slo.builder().id("b").target(0.995).build();

        assertThat(percent.getTarget()).isCloseTo(0.999, within(1e-12));
        assertThat(fraction.getErrorBudgetFraction()).isCloseTo(0.005, within(1e-12));
    }
}
