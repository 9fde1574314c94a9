package com.company.reliability.service;

import com.company.reliability.domain.AlertEvent;
import com.company.reliability.domain.AlertRule;
import com.company.reliability.domain.ErrorBudget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Stateless rule engine: which of the given rules fire for a budget.
 */
@Service
@Slf4j
public class AlertEvaluator {

    // absorbs rounding in percent arithmetic so that exactly 80% meets an 80% threshold
    private static final double PERCENT_TOLERANCE = 1e-9;

    /**
     * One event per firing rule, in rule order. Disabled rules and rules for
     * another service or SLO are skipped.
     */
    public List<AlertEvent> evaluateRules(ErrorBudget budget, List<AlertRule> rules) {
        List<AlertEvent> events = new ArrayList<>();
        if (rules == null) {
            return events;
        }

        for (AlertRule rule : rules) {
            if (!rule.appliesTo(budget)) {
                continue;
            }
            evaluateRule(budget, rule).ifPresent(events::add);
        }
        return events;
    }

    public Optional<AlertEvent> evaluateRule(ErrorBudget budget, AlertRule rule) {
        if (rule.getAlertType() == null) {
            return Optional.empty();
        }

        switch (rule.getAlertType()) {
            case BUDGET_THRESHOLD:
                return checkBudgetThreshold(budget, rule);
            case BURN_RATE:
                return checkBurnRate(budget, rule);
            case BUDGET_EXHAUSTION:
                return checkBudgetExhaustion(budget, rule);
            case UNKNOWN:
            default:
                log.debug("Rule {} has no recognised type, ignoring", rule.getId());
                return Optional.empty();
        }
    }

    private Optional<AlertEvent> checkBudgetThreshold(ErrorBudget budget, AlertRule rule) {
        double consumedPercent = budget.getPercentConsumed();
        double thresholdPercent = rule.getThreshold() * 100.0;

        if (!(consumedPercent + PERCENT_TOLERANCE >= thresholdPercent)) {
            return Optional.empty();
        }

        Map<String, Object> details = baseDetails(budget);
        details.put("budget_consumed_percent", consumedPercent);
        details.put("threshold_percent", thresholdPercent);

        String message = String.format(
                "Service %s SLO %s has consumed %.1f%% of its error budget (threshold %.0f%%). "
                        + "Remaining: %.1f minutes. Status: %s.%s",
                budget.getService(), budget.getSloId(), consumedPercent, thresholdPercent,
                budget.getRemainingMinutes(), budget.getStatus(), thresholdAdvice(consumedPercent));

        return Optional.of(buildEvent(budget, rule, "Error Budget Alert: " + budget.getService(), message, details));
    }

    private Optional<AlertEvent> checkBurnRate(ErrorBudget budget, AlertRule rule) {
        Double burnRate = budget.getBurnRate();
        if (burnRate == null || Double.isNaN(burnRate) || burnRate <= 0.0) {
            return Optional.empty();
        }

        double multiple = budget.getBurnRateMultiple();
        if (!(multiple >= rule.getThreshold())) {
            return Optional.empty();
        }

        Map<String, Object> details = baseDetails(budget);
        details.put("burn_rate_multiple", multiple);
        details.put("threshold_multiple", rule.getThreshold());

        String message = String.format(
                "Service %s SLO %s is burning error budget at %.2fx the sustainable rate (threshold %.1fx). "
                        + "Burned: %.1f minutes, remaining: %.1f minutes.%s",
                budget.getService(), budget.getSloId(), multiple, rule.getThreshold(),
                budget.getBurnedMinutes(), budget.getRemainingMinutes(), burnRateAdvice(multiple));

        return Optional.of(buildEvent(budget, rule, "High Burn Rate Alert: " + budget.getService(), message, details));
    }

    private Optional<AlertEvent> checkBudgetExhaustion(ErrorBudget budget, AlertRule rule) {
        Double burnRate = budget.getBurnRate();
        if (burnRate == null || Double.isNaN(burnRate) || burnRate <= 0.0) {
            return Optional.empty();
        }

        double hoursUntilExhaustion = budget.getRemainingMinutes() / (burnRate * 60.0);
        if (!(hoursUntilExhaustion <= rule.getThreshold())) {
            return Optional.empty();
        }

        Map<String, Object> details = baseDetails(budget);
        details.put("hours_until_exhaustion", hoursUntilExhaustion);
        details.put("threshold_hours", rule.getThreshold());

        String message = String.format(
                "Service %s SLO %s will exhaust its error budget in %.1f hours at the current burn rate "
                        + "(threshold %.1f hours). Remaining: %.1f minutes.",
                budget.getService(), budget.getSloId(), hoursUntilExhaustion, rule.getThreshold(),
                budget.getRemainingMinutes());

        return Optional.of(buildEvent(budget, rule, "Budget Exhaustion Alert: " + budget.getService(), message, details));
    }

    private Map<String, Object> baseDetails(ErrorBudget budget) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("burned_minutes", budget.getBurnedMinutes());
        details.put("remaining_minutes", budget.getRemainingMinutes());
        details.put("total_budget_minutes", budget.getTotalBudgetMinutes());
        details.put("burn_rate", budget.getBurnRate());
        details.put("status", budget.getStatus() != null ? budget.getStatus().name() : null);
        return details;
    }

    private AlertEvent buildEvent(ErrorBudget budget, AlertRule rule, String title, String message,
                                  Map<String, Object> details) {
        Instant now = Instant.now();
        return AlertEvent.builder()
                .id(String.format("alert-%s-%d-%s", budget.getService(), now.getEpochSecond(),
                        UUID.randomUUID().toString().substring(0, 8)))
                .ruleId(rule.getId())
                .service(budget.getService())
                .sloId(budget.getSloId())
                .severity(rule.getSeverity())
                .title(title)
                .message(message)
                .details(details)
                .triggeredAt(now)
                .build();
    }

    private String thresholdAdvice(double consumedPercent) {
        if (consumedPercent >= 90.0) {
            return " Budget nearly exhausted, consider a deployment freeze.";
        }
        if (consumedPercent >= 75.0) {
            return " Budget running low, review recent changes and incidents.";
        }
        return " Monitor closely.";
    }

    private String burnRateAdvice(double multiple) {
        if (multiple >= 6.0) {
            return " Budget will be gone within hours, investigate immediately.";
        }
        if (multiple >= 3.0) {
            return " Check recent deployments and incidents.";
        }
        return " Monitor the situation.";
    }
}
