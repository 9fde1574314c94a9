package com.company.reliability.controller;

import com.company.reliability.domain.CorrelationResult;
import com.company.reliability.domain.Deployment;
import com.company.reliability.domain.Slo;
import com.company.reliability.dto.request.RecordDeploymentRequest;
import com.company.reliability.exception.DeploymentNotFoundException;
import com.company.reliability.repository.DependencyGraph;
import com.company.reliability.repository.ReliabilityRepository;
import com.company.reliability.service.DeploymentCorrelator;
import com.company.reliability.service.DeploymentRecorder;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@RestController
@RequestMapping("/api/v1/deployments")
@Tag(name = "Deployments", description = "Deployment recording and burn correlation")
@RequiredArgsConstructor
@Slf4j
public class DeploymentController {

    private final DeploymentRecorder recorder;
    private final DeploymentCorrelator correlator;
    private final ReliabilityRepository repository;
    private final DependencyGraph dependencyGraph;

    @PostMapping
    @Operation(summary = "Record a deployment")
    public ResponseEntity<Deployment> record(@Valid @RequestBody RecordDeploymentRequest request) {
        Deployment deployment = recorder.recordManual(request);
        return created(deployment);
    }

    @PostMapping("/webhooks/argocd")
    @Operation(summary = "ArgoCD sync notification")
    public ResponseEntity<Deployment> argoCdWebhook(@RequestBody JsonNode payload) {
        return created(recorder.recordFromArgoCd(payload));
    }

    @PostMapping("/webhooks/github")
    @Operation(summary = "GitHub Actions workflow_run event")
    public ResponseEntity<Deployment> githubWebhook(@RequestBody JsonNode payload) {
        return created(recorder.recordFromGithub(payload));
    }

    @PostMapping("/{deploymentId}/correlate")
    @Operation(summary = "Correlate a deployment with its service's SLOs",
            description = "Results are ordered by confidence, highest first")
    public ResponseEntity<List<CorrelationResult>> correlate(@PathVariable String deploymentId) {
        Deployment deployment = repository.getDeployment(deploymentId)
                .orElseThrow(() -> new DeploymentNotFoundException(deploymentId));

        List<CorrelationResult> results = new ArrayList<>();
        for (Slo slo : repository.getSlosByService(deployment.getService())) {
            results.add(correlator.correlateDeployment(deployment, slo, dependencyGraph, null));
        }
        results.sort(Comparator.comparingDouble(CorrelationResult::getConfidence).reversed());

        log.info("Correlated deployment {} against {} SLOs", deploymentId, results.size());
        return ResponseEntity.ok(results);
    }

    private ResponseEntity<Deployment> created(Deployment deployment) {
        return ResponseEntity
                .created(URI.create("/api/v1/deployments/" + deployment.getId()))
                .body(deployment);
    }
}
