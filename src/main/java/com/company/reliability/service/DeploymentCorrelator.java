package com.company.reliability.service;

import com.company.reliability.domain.CorrelationResult;
import com.company.reliability.domain.CorrelationWindow;
import com.company.reliability.domain.Deployment;
import com.company.reliability.domain.DownstreamService;
import com.company.reliability.domain.Slo;
import com.company.reliability.domain.enums.ConfidenceLevel;
import com.company.reliability.repository.DependencyEdge;
import com.company.reliability.repository.DependencyGraph;
import com.company.reliability.repository.ReliabilityRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attributes error budget burn to deployments with a weighted score over
 * five factors: burn rate change, time proximity, burn magnitude,
 * dependency relationship and the service's deployment history.
 */
@Service
@Slf4j
public class DeploymentCorrelator {

    static final double WEIGHT_BURN_RATE = 0.35;
    static final double WEIGHT_PROXIMITY = 0.25;
    static final double WEIGHT_MAGNITUDE = 0.15;
    static final double WEIGHT_DEPENDENCY = 0.15;
    static final double WEIGHT_HISTORY = 0.10;

    static final String METHOD = "multi_factor_window_analysis";

    private final ReliabilityRepository repository;
    private final CorrelationWindow window;
    private final MeterRegistry meterRegistry;

    public DeploymentCorrelator(ReliabilityRepository repository, CorrelationWindow window,
                                MeterRegistry meterRegistry) {
        this.repository = repository;
        this.window = window != null ? window : CorrelationWindow.defaults();
        this.meterRegistry = meterRegistry;
    }

    public CorrelationResult correlateDeployment(Deployment deployment, Slo slo) {
        return correlateDeployment(deployment, slo, null, null);
    }

    public CorrelationResult correlateDeployment(Deployment deployment, Slo slo, DependencyGraph dependencyGraph,
                                                 List<DownstreamService> downstreamServices) {
        Instant deployedAt = deployment.getDeployedAt();
        Instant beforeStart = deployedAt.minus(window.getBeforeMinutes(), ChronoUnit.MINUTES);
        Instant afterEnd = deployedAt.plus(window.getAfterMinutes(), ChronoUnit.MINUTES);

        double beforeRate = repository.getBurnRateWindow(slo.getId(), beforeStart, deployedAt);
        double afterRate = repository.getBurnRateWindow(slo.getId(), deployedAt, afterEnd);
        double burnMinutes = afterRate * window.getAfterMinutes();

        Double detectionMinutes = findBurnDetectionMinutes(slo.getId(), deployedAt, beforeRate);

        double burnRateScore = clamp(burnRateScore(beforeRate, afterRate));
        double proximityScore = clamp(proximityScore(detectionMinutes));
        double magnitudeScore = clamp(magnitudeScore(burnMinutes));
        double dependencyScore = clamp(dependencyScore(deployment.getService(), slo.getService(),
                dependencyGraph, downstreamServices));
        double historyScore = clamp(historyScoreOrZero(deployment));

        double confidence = clamp(WEIGHT_BURN_RATE * burnRateScore
                + WEIGHT_PROXIMITY * proximityScore
                + WEIGHT_MAGNITUDE * magnitudeScore
                + WEIGHT_DEPENDENCY * dependencyScore
                + WEIGHT_HISTORY * historyScore);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("burn_rate_score", burnRateScore);
        details.put("proximity_score", proximityScore);
        details.put("magnitude_score", magnitudeScore);
        details.put("dependency_score", dependencyScore);
        details.put("history_score", historyScore);
        details.put("before_rate", beforeRate);
        details.put("after_rate", afterRate);
        details.put("detection_minutes", detectionMinutes);
        details.put("before_window_minutes", window.getBeforeMinutes());
        details.put("after_window_minutes", window.getAfterMinutes());

        CorrelationResult result = CorrelationResult.builder()
                .deploymentId(deployment.getId())
                .service(deployment.getService())
                .sloId(slo.getId())
                .burnMinutes(burnMinutes)
                .confidence(confidence)
                .method(METHOD)
                .details(details)
                .build();

        if (confidence >= ConfidenceLevel.LOW.getFloor()) {
            repository.updateDeploymentCorrelation(deployment.getId(), burnMinutes, confidence);
            deployment.setCorrelatedBurnMinutes(burnMinutes);
            deployment.setCorrelationConfidence(confidence);
        }

        meterRegistry.counter("reliability.correlations",
                "confidence", result.getConfidenceLabel().name()
        ).increment();

        log.info("Deployment {} vs SLO {}: confidence {} ({}), burn {} minutes",
                deployment.getId(), slo.getId(), String.format("%.2f", confidence),
                result.getConfidenceLabel(), String.format("%.1f", burnMinutes));
        return result;
    }

    /**
     * Correlates every recent deployment of {@code service} against each of
     * its SLOs. Failures are logged per pair and do not stop the batch.
     *
     * @return results at LOW confidence or above, highest confidence first
     */
    public List<CorrelationResult> correlateService(String service, int lookbackHours,
                                                    DependencyGraph dependencyGraph) {
        List<Deployment> deployments = repository.getRecentDeployments(service, lookbackHours);
        List<Slo> slos = repository.getSlosByService(service);
        List<CorrelationResult> results = new ArrayList<>();

        for (Deployment deployment : deployments) {
            for (Slo slo : slos) {
                try {
                    CorrelationResult result = correlateDeployment(deployment, slo, dependencyGraph, null);
                    if (result.getConfidence() >= ConfidenceLevel.LOW.getFloor()) {
                        results.add(result);
                    }
                } catch (Exception e) {
                    log.error("Correlation failed for deployment {} and SLO {}", deployment.getId(), slo.getId(), e);
                    meterRegistry.counter("reliability.correlations.failures", "service", service).increment();
                }
            }
        }

        results.sort(Comparator.comparingDouble(CorrelationResult::getConfidence).reversed());
        return results;
    }

    double burnRateScore(double beforeRate, double afterRate) {
        if (beforeRate == 0.0) {
            return Math.min(afterRate / 0.1, 1.0);
        }
        // a 5x spike saturates
        return Math.min((afterRate / beforeRate) / 5.0, 1.0);
    }

    double proximityScore(Double minutesElapsed) {
        if (minutesElapsed == null) {
            return 0.0;
        }
        return Math.exp(-minutesElapsed / 30.0);
    }

    double magnitudeScore(double burnMinutes) {
        return Math.min(burnMinutes / 10.0, 1.0);
    }

    double dependencyScore(String deployingService, String affectedService, DependencyGraph dependencyGraph,
                           List<DownstreamService> downstreamServices) {
        if (deployingService != null && deployingService.equals(affectedService)) {
            return 1.0;
        }

        if (dependencyGraph != null) {
            try {
                if (dependencyGraph.getUpstream(affectedService).contains(deployingService)) {
                    return 1.0;
                }
                for (DependencyEdge edge : dependencyGraph.getTransitiveUpstream(affectedService)) {
                    if (edge.getUpstream().equals(deployingService) && edge.getDepth() >= 2) {
                        return 0.4;
                    }
                }
            } catch (Exception e) {
                log.warn("Dependency graph lookup failed for {}: {}", affectedService, e.getMessage());
            }
            return 0.0;
        }

        if (downstreamServices != null) {
            for (DownstreamService downstream : downstreamServices) {
                if (downstream.getName() != null && downstream.getName().equals(affectedService)) {
                    return 0.6;
                }
            }
        }
        return 0.0;
    }

    /**
     * Share of the service's recent deployments (excluding this one) that
     * were previously correlated at MEDIUM confidence or above. Any
     * repository failure yields 0.0.
     */
    double historyScoreOrZero(Deployment deployment) {
        try {
            List<Deployment> history = repository.getRecentDeployments(
                    deployment.getService(), window.getHistoryLookbackHours());

            int considered = 0;
            int problematic = 0;
            for (Deployment previous : history) {
                if (previous.getId() != null && previous.getId().equals(deployment.getId())) {
                    continue;
                }
                considered++;
                Double confidence = previous.getCorrelationConfidence();
                if (confidence != null && confidence >= ConfidenceLevel.MEDIUM.getFloor()) {
                    problematic++;
                }
            }

            if (considered == 0) {
                return 0.0;
            }
            return Math.min((double) problematic / considered, 1.0);
        } catch (Exception e) {
            log.warn("History lookup failed for {}, scoring history as 0: {}",
                    deployment.getService(), e.getMessage());
            return 0.0;
        }
    }

    /**
     * Minutes from the deployment to the first detection step of the after
     * window whose burn rate exceeds the pre-deploy rate, or null when burn
     * never rises.
     */
    private Double findBurnDetectionMinutes(String sloId, Instant deployedAt, double beforeRate) {
        int step = Math.max(1, window.getDetectionStepMinutes());
        for (int offset = 0; offset < window.getAfterMinutes(); offset += step) {
            Instant stepStart = deployedAt.plus(offset, ChronoUnit.MINUTES);
            Instant stepEnd = deployedAt.plus(Math.min(offset + step, window.getAfterMinutes()), ChronoUnit.MINUTES);
            double stepRate = repository.getBurnRateWindow(sloId, stepStart, stepEnd);
            if (stepRate > beforeRate) {
                return (double) offset;
            }
        }
        return null;
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
