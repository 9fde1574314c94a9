package com.company.reliability.service;

import com.company.reliability.domain.DownstreamService;
import com.company.reliability.domain.GateCheckResult;
import com.company.reliability.domain.GateCondition;
import com.company.reliability.domain.GateException;
import com.company.reliability.domain.GatePolicy;
import com.company.reliability.domain.enums.GateDecision;
import com.company.reliability.domain.enums.ServiceTier;
import com.company.reliability.dto.request.GateCheckRequest;
import com.company.reliability.exception.ValidationException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Approves, warns on or blocks a deployment from the remaining error budget
 * and the tier (or custom) policy.
 * <p>
 * Decision order: team exception, then the blocking threshold (possibly
 * replaced by the first matching condition), then the warning threshold.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeploymentGate {

    private final PolicyConditionEvaluator conditionEvaluator;
    private final MeterRegistry meterRegistry;

    public GateCheckResult checkDeployment(String service, String tier, double budgetTotalMinutes,
                                           double budgetConsumedMinutes, List<DownstreamService> downstreamServices,
                                           String team, GatePolicy policy) {
        return checkDeployment(GateCheckRequest.builder()
                .service(service)
                .tier(tier)
                .budgetTotalMinutes(budgetTotalMinutes)
                .budgetConsumedMinutes(budgetConsumedMinutes)
                .downstreamServices(downstreamServices != null ? downstreamServices : new ArrayList<>())
                .team(team)
                .policy(policy)
                .build());
    }

    public GateCheckResult checkDeployment(GateCheckRequest request) {
        double total = request.getBudgetTotalMinutes();
        double consumed = request.getBudgetConsumedMinutes();
        double remaining = Math.max(0.0, total - consumed);
        // no budget data: never block
        double remainingPct = total > 0 ? remaining / total * 100.0 : 100.0;

        ServiceTier serviceTier = ServiceTier.fromString(request.getTier());
        GatePolicy effective = effectivePolicy(serviceTier, request.getPolicy());
        Double warning = effective.getWarning();
        Double blocking = effective.getBlocking();

        List<DownstreamService> downstream = request.getDownstreamServices() != null
                ? request.getDownstreamServices() : new ArrayList<>();
        List<String> allDownstream = downstream.stream()
                .map(DownstreamService::getName)
                .collect(Collectors.toList());
        List<String> highCriticality = downstream.stream()
                .filter(DownstreamService::isHighCriticality)
                .map(DownstreamService::getName)
                .collect(Collectors.toList());

        GateCheckResult.GateCheckResultBuilder result = GateCheckResult.builder()
                .service(request.getService())
                .tier(serviceTier.getValue())
                .budgetTotalMinutes(total)
                .budgetConsumedMinutes(consumed)
                .budgetRemainingMinutes(remaining)
                .budgetRemainingPercentage(remainingPct)
                .warningThreshold(warning)
                .downstreamServices(allDownstream)
                .highCriticalityDownstream(highCriticality);

        List<String> recommendations = new ArrayList<>();

        GateException bypass = findBypass(effective, request.getTeam());
        if (bypass != null) {
            result.result(GateDecision.APPROVED)
                    .blockingThreshold(blocking)
                    .bypassedBy(bypass.getTeam())
                    .message(String.format("Deployment APPROVED: policy exception for team %s (%.1f%% budget remaining)",
                            bypass.getTeam(), remainingPct));
            recommendations.add("Approved through a policy exception, budget thresholds were not applied");
            recommendations.add(String.format("Budget remaining: %.0f minutes of %.0f minutes", remaining, total));
        } else {
            PolicyContext context = PolicyContext.builder()
                    .budgetRemaining(remainingPct)
                    .budgetConsumed(100.0 - remainingPct)
                    .burnRate(request.getBurnRate())
                    .tier(serviceTier.getValue())
                    .environment(request.getEnvironment())
                    .service(request.getService())
                    .team(request.getTeam())
                    .downstreamCount(allDownstream.size())
                    .highCriticalityDownstream(highCriticality.size())
                    .build();

            GateCondition matched = findMatchingCondition(effective, context);
            if (matched != null) {
                blocking = matched.getBlocking();
                result.matchedCondition(matched.getName());
            }
            result.blockingThreshold(blocking);

            decide(result, recommendations, remainingPct, remaining, total, warning, blocking);
        }

        appendBlastRadius(recommendations, allDownstream, highCriticality);
        GateCheckResult check = result.recommendations(recommendations).build();

        meterRegistry.counter("reliability.gate.decisions",
                "tier", serviceTier.getValue(),
                "result", check.getResult().name()
        ).increment();

        log.info("Gate check for {} ({}): {} with {}% budget remaining",
                request.getService(), serviceTier.getValue(), check.getResult(), String.format("%.1f", remainingPct));
        return check;
    }

    private void decide(GateCheckResult.GateCheckResultBuilder result, List<String> recommendations,
                        double remainingPct, double remaining, double total, Double warning, Double blocking) {
        if (blocking != null && remainingPct < blocking) {
            result.result(GateDecision.BLOCKED)
                    .message(String.format("Deployment BLOCKED: error budget exhausted (%.1f%% remaining, blocking threshold %.0f%%)",
                            remainingPct, blocking));
            recommendations.add("Focus on reliability work before shipping new features");
            recommendations.add("Review recent incidents and deployments that burned budget");
            recommendations.add("Deploy only fixes that reduce error rates until budget recovers");
        } else if (warning != null && remainingPct < warning) {
            result.result(GateDecision.WARNING)
                    .message(String.format("Deployment WARNING: error budget low (%.1f%% remaining, warning threshold %.0f%%)",
                            remainingPct, warning));
            recommendations.add(String.format("Budget remaining: %.0f minutes", remaining));
            recommendations.add("Have a rollback plan ready");
            recommendations.add("Monitor closely after deployment");
        } else {
            result.result(GateDecision.APPROVED)
                    .message(String.format("Deployment APPROVED: error budget healthy (%.1f%% remaining)", remainingPct));
            recommendations.add(String.format("Budget remaining: %.0f minutes of %.0f minutes", remaining, total));
            recommendations.add("Continue monitoring post-deployment");
        }
    }

    private void appendBlastRadius(List<String> recommendations, List<String> allDownstream,
                                   List<String> highCriticality) {
        if (!highCriticality.isEmpty()) {
            recommendations.add(String.format("Blast radius: %d high-criticality service(s) potentially affected: %s",
                    highCriticality.size(), String.join(", ", highCriticality)));
        } else if (!allDownstream.isEmpty()) {
            recommendations.add(String.format("Blast radius: %d downstream service(s) potentially affected: %s",
                    allDownstream.size(), String.join(", ", allDownstream)));
        }
    }

    /**
     * A policy that declares thresholds replaces the tier defaults outright;
     * one that only carries conditions or exceptions keeps them.
     */
    private GatePolicy effectivePolicy(ServiceTier tier, GatePolicy custom) {
        GatePolicy defaults = GatePolicy.forTier(tier);
        if (custom == null) {
            return defaults;
        }
        boolean declaresThresholds = custom.getWarning() != null || custom.getBlocking() != null;
        return GatePolicy.builder()
                .warning(declaresThresholds ? custom.getWarning() : defaults.getWarning())
                .blocking(declaresThresholds ? custom.getBlocking() : defaults.getBlocking())
                .conditions(custom.getConditions() != null ? custom.getConditions() : new ArrayList<>())
                .exceptions(custom.getExceptions() != null ? custom.getExceptions() : new ArrayList<>())
                .build();
    }

    private GateException findBypass(GatePolicy policy, String team) {
        if (team == null) {
            return null;
        }
        for (GateException exception : policy.getExceptions()) {
            if (exception.bypasses(team)) {
                return exception;
            }
        }
        return null;
    }

    private GateCondition findMatchingCondition(GatePolicy policy, PolicyContext context) {
        for (GateCondition condition : policy.getConditions()) {
            try {
                if (conditionEvaluator.evaluate(condition.getWhen(), context)) {
                    return condition;
                }
            } catch (ValidationException e) {
                log.warn("Skipping gate condition '{}': {}", condition.getName(), e.getMessage());
                meterRegistry.counter("reliability.gate.invalid_conditions").increment();
            }
        }
        return null;
    }
}
