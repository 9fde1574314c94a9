package com.company.reliability.scheduled;

import com.company.reliability.domain.CorrelationResult;
import com.company.reliability.domain.ServiceProfile;
import com.company.reliability.repository.DependencyGraph;
import com.company.reliability.repository.ReliabilityRepository;
import com.company.reliability.service.DeploymentCorrelator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Re-correlates recent deployments of every service so that attribution
 * catches up once the post-deploy window has filled with snapshots.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "reliability.correlation.job.enabled",
        havingValue = "true",
        matchIfMissing = false
)
public class DeploymentCorrelationJob {

    private final ReliabilityRepository repository;
    private final DeploymentCorrelator correlator;
    private final DependencyGraph dependencyGraph;
    private final MeterRegistry meterRegistry;

    @Value("${reliability.correlation.job.lookback-hours:24}")
    private int lookbackHours;

    @Scheduled(
            fixedDelayString = "${reliability.correlation.job.interval-ms:900000}",
            initialDelayString = "${reliability.correlation.job.initial-delay-ms:60000}"
    )
    public void correlateRecentDeployments() {
        Instant startTime = Instant.now();
        int correlated = 0;

        List<ServiceProfile> profiles;
        try {
            profiles = repository.findServiceProfiles();
        } catch (Exception e) {
            log.error("Could not load service profiles for correlation", e);
            meterRegistry.counter("reliability.correlation.job_failures").increment();
            return;
        }

        for (ServiceProfile profile : profiles) {
            try {
                List<CorrelationResult> results = correlator.correlateService(
                        profile.getService(), lookbackHours, dependencyGraph);
                correlated += results.size();
                for (CorrelationResult result : results) {
                    log.info("Deployment {} correlated with SLO {} at {} confidence",
                            result.getDeploymentId(), result.getSloId(), result.getConfidenceLabel());
                }
            } catch (Exception e) {
                log.error("Correlation failed for service {}", profile.getService(), e);
                meterRegistry.counter("reliability.correlation.job_failures").increment();
            }
        }

        log.info("Deployment correlation completed: {} correlations across {} services in {}ms",
                correlated, profiles.size(), Duration.between(startTime, Instant.now()).toMillis());
    }
}
