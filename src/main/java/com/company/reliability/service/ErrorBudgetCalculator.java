package com.company.reliability.service;

import com.company.reliability.domain.ErrorBudget;
import com.company.reliability.domain.SliMeasurement;
import com.company.reliability.domain.Slo;
import com.company.reliability.domain.enums.SloStatus;
import com.company.reliability.exception.InsufficientDataException;
import com.company.reliability.exception.ValidationException;
import com.company.reliability.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns SLI measurements into an error budget for one SLO and period.
 * Pure: persisting the result is the caller's job.
 */
@Service
@Slf4j
public class ErrorBudgetCalculator {

    static final double DEFAULT_SAMPLE_MINUTES = 5.0;

    public ErrorBudget calculate(Slo slo, List<SliMeasurement> measurements, Instant periodEnd) {
        Instant periodStart = slo.getTimeWindow().getStartTime(periodEnd);
        return calculate(slo, periodStart, periodEnd, measurements);
    }

    public ErrorBudget calculate(Slo slo, Instant periodStart, Instant periodEnd,
                                 List<SliMeasurement> measurements) {
        if (measurements == null || measurements.isEmpty()) {
            throw new InsufficientDataException(
                    "No SLI measurements for SLO " + slo.getId() + ", cannot compute error budget");
        }
        if (!periodEnd.isAfter(periodStart)) {
            throw new ValidationException("Period end must be after period start for SLO " + slo.getId());
        }

        double windowMinutes = TimeUtils.minutesBetween(periodStart, periodEnd);
        double totalBudgetMinutes = windowMinutes * slo.getErrorBudgetFraction();

        List<SliMeasurement> inPeriod = measurements.stream()
                .filter(m -> m.getTimestamp() != null)
                .filter(m -> !m.getTimestamp().isBefore(periodStart) && !m.getTimestamp().isAfter(periodEnd))
                .sorted(Comparator.comparing(SliMeasurement::getTimestamp))
                .collect(Collectors.toList());

        double burnedMinutes = 0.0;
        Instant coveredUntil = periodStart;

        for (int i = 0; i < inPeriod.size(); i++) {
            SliMeasurement current = inPeriod.get(i);
            SliMeasurement next = i + 1 < inPeriod.size() ? inPeriod.get(i + 1) : null;

            double durationMinutes = sampleMinutes(current, next);
            // NaN means the source had no data; it is carried into the total on purpose
            double errorRate = Double.isNaN(current.getValue()) ? Double.NaN : Math.max(0.0, 1.0 - current.getValue());
            burnedMinutes += errorRate * durationMinutes;

            Instant sampleEnd = current.getTimestamp().plusMillis(Math.round(durationMinutes * 60_000));
            if (sampleEnd.isAfter(coveredUntil)) {
                coveredUntil = sampleEnd;
            }
        }

        if (coveredUntil.isAfter(periodEnd)) {
            coveredUntil = periodEnd;
        }
        double elapsedMinutes = TimeUtils.minutesBetween(periodStart, coveredUntil);
        double burnRate = elapsedMinutes > 0 ? burnedMinutes / elapsedMinutes : 0.0;

        ErrorBudget budget = ErrorBudget.builder()
                .sloId(slo.getId())
                .service(slo.getService())
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .totalBudgetMinutes(totalBudgetMinutes)
                .burnedMinutes(burnedMinutes)
                .remainingMinutes(ErrorBudget.remainingOf(totalBudgetMinutes, burnedMinutes))
                .sloBreachBurnMinutes(burnedMinutes)
                .burnRate(burnRate)
                .updatedAt(Instant.now())
                .build();
        budget.setStatus(SloStatus.fromPercentConsumed(budget.getPercentConsumed()));

        log.debug("SLO {}: {} of {} budget minutes burned from {} samples ({})",
                slo.getId(), burnedMinutes, totalBudgetMinutes, inPeriod.size(), budget.getStatus());
        return budget;
    }

    /**
     * Synthetic budget with {@code burnPercent} of the budget consumed and a
     * burn rate of {@code burnPercent / 50} times the sustainable rate.
     */
    public ErrorBudget simulate(Slo slo, double burnPercent, Instant periodEnd) {
        Instant periodStart = slo.getTimeWindow().getStartTime(periodEnd);
        double windowMinutes = TimeUtils.minutesBetween(periodStart, periodEnd);
        double totalBudgetMinutes = windowMinutes * slo.getErrorBudgetFraction();
        double burnedMinutes = totalBudgetMinutes * burnPercent / 100.0;
        double baseline = windowMinutes > 0 ? totalBudgetMinutes / windowMinutes : 0.0;

        ErrorBudget budget = ErrorBudget.builder()
                .sloId(slo.getId())
                .service(slo.getService())
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .totalBudgetMinutes(totalBudgetMinutes)
                .burnedMinutes(burnedMinutes)
                .remainingMinutes(ErrorBudget.remainingOf(totalBudgetMinutes, burnedMinutes))
                .burnRate(baseline * burnPercent / 50.0)
                .updatedAt(Instant.now())
                .build();
        budget.setStatus(SloStatus.fromPercentConsumed(budget.getPercentConsumed()));
        return budget;
    }

    /**
     * When the remaining budget runs out at the current burn rate. Empty when
     * the budget is not being consumed.
     */
    public Optional<Instant> projectExhaustion(ErrorBudget budget, Instant from) {
        Double burnRate = budget.getBurnRate();
        if (burnRate == null || Double.isNaN(burnRate) || burnRate <= 0.0
                || Double.isNaN(budget.getRemainingMinutes())) {
            return Optional.empty();
        }
        double minutesLeft = budget.getRemainingMinutes() / burnRate;
        return Optional.of(from.plus(Duration.ofMillis(Math.round(minutesLeft * 60_000))));
    }

    private double sampleMinutes(SliMeasurement current, SliMeasurement next) {
        if (current.getDurationSeconds() != null) {
            return current.getDurationSeconds() / 60.0;
        }
        if (next != null) {
            return TimeUtils.minutesBetween(current.getTimestamp(), next.getTimestamp());
        }
        return DEFAULT_SAMPLE_MINUTES;
    }
}
