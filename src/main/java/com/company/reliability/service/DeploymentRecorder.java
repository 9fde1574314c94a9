package com.company.reliability.service;

import com.company.reliability.domain.Deployment;
import com.company.reliability.dto.request.RecordDeploymentRequest;
import com.company.reliability.exception.ValidationException;
import com.company.reliability.repository.ReliabilityRepository;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;

/**
 * Records deployments from manual input and CD webhooks (ArgoCD sync
 * notifications, GitHub Actions workflow runs).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeploymentRecorder {

    private static final int SHORT_SHA_LENGTH = 12;

    private final ReliabilityRepository repository;
    private final MeterRegistry meterRegistry;

    public Deployment recordManual(RecordDeploymentRequest request) {
        Deployment deployment = Deployment.builder()
                .id(shortSha(request.getCommitSha()))
                .service(request.getService())
                .environment(request.getEnvironment() != null ? request.getEnvironment() : "production")
                .deployedAt(request.getDeployedAt() != null ? request.getDeployedAt() : Instant.now())
                .commitSha(request.getCommitSha())
                .author(request.getAuthor())
                .prNumber(request.getPrNumber())
                .source("manual")
                .build();

        return save(deployment);
    }

    /**
     * Expects {@code app.metadata.name}, {@code app.spec.source.targetRevision}
     * and an optional ISO-8601 {@code timestamp}.
     */
    public Deployment recordFromArgoCd(JsonNode payload) {
        JsonNode app = payload.path("app");
        String service = app.path("metadata").path("name").asText("unknown");
        String commitSha = app.path("spec").path("source").path("targetRevision").asText("unknown");

        Map<String, Object> extra = new HashMap<>();
        extra.put("sync_type", payload.path("type").asText(null));

        Deployment deployment = Deployment.builder()
                .id("argocd-" + shortSha(commitSha))
                .service(service)
                .environment(app.path("metadata").path("namespace").asText("production"))
                .deployedAt(parseTimestamp(payload.path("timestamp")))
                .commitSha(commitSha)
                .source("argocd")
                .extraData(extra)
                .build();

        return save(deployment);
    }

    /**
     * Expects a {@code workflow_run} event; the repository name is taken as
     * the service.
     */
    public Deployment recordFromGithub(JsonNode payload) {
        JsonNode workflowRun = payload.path("workflow_run");
        String service = payload.path("repository").path("name").asText("unknown");
        String commitSha = workflowRun.path("head_sha").asText("unknown");
        String login = payload.path("sender").path("login").asText(null);

        Integer prNumber = null;
        JsonNode pullRequests = workflowRun.path("pull_requests");
        if (pullRequests.isArray() && pullRequests.size() > 0) {
            prNumber = pullRequests.get(0).path("number").asInt();
        }

        Map<String, Object> extra = new HashMap<>();
        extra.put("workflow_name", workflowRun.path("name").asText(null));
        extra.put("conclusion", workflowRun.path("conclusion").asText(null));

        Deployment deployment = Deployment.builder()
                .id("gh-" + shortSha(commitSha))
                .service(service)
                .environment("production")
                .deployedAt(parseTimestamp(workflowRun.path("created_at")))
                .commitSha(commitSha)
                .author(login != null ? login + "@github.com" : null)
                .prNumber(prNumber)
                .source("github")
                .extraData(extra)
                .build();

        return save(deployment);
    }

    private Deployment save(Deployment deployment) {
        repository.createDeployment(deployment);

        meterRegistry.counter("reliability.deployments.recorded",
                "source", deployment.getSource()
        ).increment();

        log.info("Recorded {} deployment {} for {} at {}",
                deployment.getSource(), deployment.getId(), deployment.getService(), deployment.getDeployedAt());
        return deployment;
    }

    private static String shortSha(String sha) {
        if (sha == null || sha.isBlank()) {
            throw new ValidationException("Commit SHA is required");
        }
        return sha.length() > SHORT_SHA_LENGTH ? sha.substring(0, SHORT_SHA_LENGTH) : sha;
    }

    private static Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            return Instant.now();
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid deployment timestamp: " + node.asText(), e);
        }
    }
}
