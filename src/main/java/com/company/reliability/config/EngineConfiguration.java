package com.company.reliability.config;

import com.company.reliability.domain.CorrelationWindow;
import com.company.reliability.repository.DependencyGraph;
import com.company.reliability.repository.InMemoryDependencyGraph;
import com.company.reliability.secrets.EnvSecretBackend;
import com.company.reliability.secrets.SecretBackendType;
import com.company.reliability.secrets.SecretResolver;
import com.company.reliability.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@Slf4j
public class EngineConfiguration {

    @Bean
    public CorrelationWindow correlationWindow(
            @Value("${reliability.correlation.before-minutes:30}") int beforeMinutes,
            @Value("${reliability.correlation.after-minutes:120}") int afterMinutes,
            @Value("${reliability.correlation.detection-step-minutes:10}") int detectionStepMinutes,
            @Value("${reliability.correlation.history-lookback-hours:168}") int historyLookbackHours) {
        return CorrelationWindow.builder()
                .beforeMinutes(beforeMinutes)
                .afterMinutes(afterMinutes)
                .detectionStepMinutes(detectionStepMinutes)
                .historyLookbackHours(historyLookbackHours)
                .build();
    }

    /**
     * Edges as {@code service->upstream}, comma separated.
     */
    @Bean
    public DependencyGraph dependencyGraph(@Value("${reliability.dependencies:}") String edges) {
        InMemoryDependencyGraph graph = new InMemoryDependencyGraph();
        if (edges == null || edges.isBlank()) {
            return graph;
        }
        for (String edge : edges.split(",")) {
            String[] parts = edge.split("->");
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                throw new ValidationException("Invalid dependency edge: " + edge);
            }
            graph.addDependency(parts[0].trim(), parts[1].trim());
        }
        log.info("Loaded {} dependency edges", edges.split(",").length);
        return graph;
    }

    @Bean
    public SecretResolver secretResolver(
            @Value("${reliability.secrets.primary:env}") String primary,
            @Value("${reliability.secrets.fallbacks:}") List<String> fallbacks) {
        List<SecretBackendType> fallbackTypes = new ArrayList<>();
        for (String fallback : fallbacks) {
            if (fallback == null || fallback.isBlank()) {
                continue;
            }
            SecretBackendType type = SecretBackendType.fromString(fallback);
            if (type == null) {
                throw new ValidationException("Unknown secret backend: " + fallback);
            }
            fallbackTypes.add(type);
        }
        SecretBackendType primaryType = SecretBackendType.fromString(primary);
        if (primaryType == null) {
            throw new ValidationException("Unknown secret backend: " + primary);
        }
        return new SecretResolver(List.of(new EnvSecretBackend()), primaryType, fallbackTypes);
    }
}
