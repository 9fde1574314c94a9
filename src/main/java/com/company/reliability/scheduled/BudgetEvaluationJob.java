package com.company.reliability.scheduled;

import com.company.reliability.domain.PortfolioEvaluationResult;
import com.company.reliability.domain.ServiceProfile;
import com.company.reliability.repository.ReliabilityRepository;
import com.company.reliability.service.AlertPipelineService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic error budget evaluation of every registered service. Requires an
 * SLI time-series source bean; services without one report per-SLO errors.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "reliability.evaluation.enabled",
        havingValue = "true",
        matchIfMissing = false
)
public class BudgetEvaluationJob {

    private final ReliabilityRepository repository;
    private final AlertPipelineService pipelineService;
    private final MeterRegistry meterRegistry;

    private final AtomicInteger worstSeverityLevel = new AtomicInteger();

    @Value("${reliability.evaluation.dispatch:true}")
    private boolean dispatch;

    @Scheduled(
            fixedDelayString = "${reliability.evaluation.interval-ms:300000}",
            initialDelayString = "${reliability.evaluation.initial-delay-ms:30000}"
    )
    public void evaluateBudgets() {
        try {
            List<ServiceProfile> profiles = repository.findServiceProfiles();
            if (profiles.isEmpty()) {
                log.debug("No service profiles registered, skipping budget evaluation");
                return;
            }

            PortfolioEvaluationResult result = pipelineService.evaluatePortfolio(profiles, dispatch);

            if (!result.getFailedServices().isEmpty()) {
                log.warn("Budget evaluation failed for services: {}", result.getFailedServices());
            }
            meterRegistry.gauge("reliability.portfolio.worst_severity", worstSeverityLevel)
                    .set(result.getWorstSeverity().getLevel());
        } catch (Exception e) {
            log.error("Budget evaluation job failed", e);
            meterRegistry.counter("reliability.evaluation.job_failures").increment();
        }
    }
}
