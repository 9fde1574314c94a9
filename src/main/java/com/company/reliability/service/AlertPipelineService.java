package com.company.reliability.service;

import com.company.reliability.domain.AlertEvent;
import com.company.reliability.domain.AlertRule;
import com.company.reliability.domain.ChannelDeliveryResult;
import com.company.reliability.domain.ErrorBudget;
import com.company.reliability.domain.PortfolioEvaluationResult;
import com.company.reliability.domain.ServiceEvaluationResult;
import com.company.reliability.domain.SliMeasurement;
import com.company.reliability.domain.Slo;
import com.company.reliability.domain.ServiceProfile;
import com.company.reliability.domain.enums.DeliveryStatus;
import com.company.reliability.exception.ProviderQueryException;
import com.company.reliability.notification.AlertNotifier;
import com.company.reliability.repository.ReliabilityRepository;
import com.company.reliability.repository.SliTimeSeriesSource;
import com.company.reliability.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs budget, rules and notification for one service, and for a whole
 * portfolio in parallel. A failing SLO or service is reported in its
 * result's errors and never stops its siblings.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertPipelineService {

    private final ErrorBudgetCalculator budgetCalculator;
    private final AlertEvaluator alertEvaluator;
    private final TierAlertRules tierAlertRules;
    private final AlertNotifier alertNotifier;
    private final ReliabilityRepository repository;
    private final ObjectProvider<SliTimeSeriesSource> timeSeriesSource;
    private final MeterRegistry meterRegistry;
    @Qualifier("portfolioExecutor")
    private final Executor portfolioExecutor;

    @Value("${reliability.collection.step:5m}")
    private String collectionStep;

    /**
     * Evaluates a service against live SLI data, persisting each budget.
     */
    public ServiceEvaluationResult evaluateService(ServiceProfile profile, boolean dispatch) {
        Instant end = Instant.now();
        return evaluate(profile, slo -> collectBudget(slo, end), true, dispatch);
    }

    /**
     * Evaluates a service as if every SLO had burned {@code burnPercent} of
     * its budget. Nothing is persisted.
     */
    public ServiceEvaluationResult simulateService(ServiceProfile profile, double burnPercent, boolean dispatch) {
        Instant end = Instant.now();
        return evaluate(profile, slo -> budgetCalculator.simulate(slo, burnPercent, end), false, dispatch);
    }

    public PortfolioEvaluationResult evaluatePortfolio(List<ServiceProfile> profiles, boolean dispatch) {
        return runPortfolio(profiles, profile -> evaluateService(profile, dispatch));
    }

    public PortfolioEvaluationResult simulatePortfolio(List<ServiceProfile> profiles, double burnPercent,
                                                       boolean dispatch) {
        return runPortfolio(profiles, profile -> simulateService(profile, burnPercent, dispatch));
    }

    private PortfolioEvaluationResult runPortfolio(List<ServiceProfile> profiles,
                                                   Function<ServiceProfile, ServiceEvaluationResult> task) {
        Instant startTime = Instant.now();

        List<CompletableFuture<ServiceEvaluationResult>> futures = profiles.stream()
                .map(profile -> CompletableFuture
                        .supplyAsync(() -> task.apply(profile), portfolioExecutor)
                        .exceptionally(e -> {
                            log.error("Evaluation failed for service {}", profile.getService(), e);
                            return ServiceEvaluationResult.failed(profile.getService(), rootMessage(e));
                        }))
                .collect(Collectors.toList());

        List<ServiceEvaluationResult> results = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        PortfolioEvaluationResult portfolio = PortfolioEvaluationResult.builder()
                .evaluatedAt(startTime)
                .results(results)
                .build();

        Duration executionTime = Duration.between(startTime, Instant.now());
        meterRegistry.timer("reliability.portfolio.duration").record(executionTime);
        log.info("Portfolio evaluation: {} services, {} alerts, {} failed, worst severity {} in {}ms",
                results.size(), portfolio.getTotalAlerts(), portfolio.getFailedServices().size(),
                portfolio.getWorstSeverity().getLabel(), executionTime.toMillis());
        return portfolio;
    }

    private ServiceEvaluationResult evaluate(ServiceProfile profile, Function<Slo, ErrorBudget> budgetFor,
                                             boolean persist, boolean dispatch) {
        String service = profile.getService();
        if (profile.getSlos() == null || profile.getSlos().isEmpty()) {
            return ServiceEvaluationResult.failed(service, "No SLOs defined for service " + service);
        }

        List<String> sloIds = profile.getSlos().stream().map(Slo::getId).collect(Collectors.toList());
        List<AlertRule> explicitRules = profile.getAlertRules().stream()
                .map(rule -> rule.getService() == null ? rule.toBuilder().service(service).build() : rule)
                .collect(Collectors.toList());
        List<AlertRule> rules = tierAlertRules.resolveEffectiveRules(service, profile.getTier(), explicitRules,
                sloIds, profile.isAutoRules(), profile.getDefaultChannels());

        ServiceEvaluationResult result = ServiceEvaluationResult.builder()
                .service(service)
                .rulesEvaluated(rules.size())
                .build();

        for (Slo slo : profile.getSlos()) {
            try {
                ErrorBudget budget = budgetFor.apply(slo);
                if (persist) {
                    repository.createOrUpdateErrorBudget(budget);
                    repository.recordBudgetSnapshot(budget);
                }
                result.getBudgets().add(budget);
                result.setBudgetsEvaluated(result.getBudgetsEvaluated() + 1);

                List<AlertEvent> events = alertEvaluator.evaluateRules(budget, rules);
                result.getEvents().addAll(events);
                result.setAlertsTriggered(result.getAlertsTriggered() + events.size());

                if (dispatch) {
                    dispatchEvents(events, rules, budget, result);
                }
            } catch (RuntimeException e) {
                log.warn("SLO {} of service {} could not be evaluated: {}", slo.getId(), service, e.getMessage());
                result.getErrors().add(slo.getId() + ": " + e.getMessage());
                meterRegistry.counter("reliability.pipeline.slo_failures", "service", service).increment();
            }
        }

        for (AlertEvent event : result.getEvents()) {
            meterRegistry.counter("reliability.alerts.fired",
                    "service", service,
                    "severity", event.getSeverity().getValue()
            ).increment();
        }
        return result;
    }

    private void dispatchEvents(List<AlertEvent> events, List<AlertRule> rules, ErrorBudget budget,
                                ServiceEvaluationResult result) {
        Map<String, AlertRule> rulesById = new LinkedHashMap<>();
        rules.forEach(rule -> rulesById.put(rule.getId(), rule));

        for (AlertEvent event : events) {
            AlertRule rule = rulesById.get(event.getRuleId());
            List<String> channels = rule != null ? rule.getChannels() : new ArrayList<>();

            Map<String, ChannelDeliveryResult> delivery = alertNotifier.sendAlert(event, channels, explain(budget));
            result.getDeliveries().add(delivery);
            long sent = delivery.values().stream()
                    .filter(d -> d.getStatus() == DeliveryStatus.SENT)
                    .count();
            result.setNotificationsSent(result.getNotificationsSent() + (int) sent);
        }
    }

    private ErrorBudget collectBudget(Slo slo, Instant end) {
        SliTimeSeriesSource source = timeSeriesSource.getIfAvailable();
        if (source == null) {
            throw new ProviderQueryException("No SLI time-series source configured");
        }
        Instant start = slo.getTimeWindow().getStartTime(end);
        List<SliMeasurement> measurements = source.getSliTimeSeries(slo.getQuery(), start, end,
                TimeUtils.parseDuration(collectionStep));
        return budgetCalculator.calculate(slo, start, end, measurements);
    }

    private String explain(ErrorBudget budget) {
        return String.format("%.1f%% of the %s budget for %s consumed, %s remaining, status %s",
                budget.getPercentConsumed(),
                TimeUtils.formatMinutes(budget.getTotalBudgetMinutes()),
                budget.getSloId(),
                TimeUtils.formatMinutes(budget.getRemainingMinutes()),
                budget.getStatus());
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
