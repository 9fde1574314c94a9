package com.company.reliability.controller;

import com.company.reliability.domain.BudgetRatioPoint;
import com.company.reliability.domain.DriftConfig;
import com.company.reliability.domain.DriftResult;
import com.company.reliability.domain.ServiceEvaluationResult;
import com.company.reliability.domain.ServiceProfile;
import com.company.reliability.domain.Slo;
import com.company.reliability.domain.TimeWindow;
import com.company.reliability.domain.enums.ServiceTier;
import com.company.reliability.dto.request.BudgetSimulationRequest;
import com.company.reliability.dto.request.DriftAnalysisRequest;
import com.company.reliability.exception.SloNotFoundException;
import com.company.reliability.exception.ValidationException;
import com.company.reliability.repository.ReliabilityRepository;
import com.company.reliability.service.AlertPipelineService;
import com.company.reliability.service.DriftAnalyzer;
import com.company.reliability.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Reliability", description = "Error budget simulation and drift analysis")
@RequiredArgsConstructor
@Slf4j
public class ReliabilityController {

    private final AlertPipelineService pipelineService;
    private final DriftAnalyzer driftAnalyzer;
    private final ReliabilityRepository repository;
    private final MeterRegistry meterRegistry;

    @PostMapping("/budgets/simulate")
    @Operation(summary = "Simulate budget burn",
            description = "Evaluates the tier and explicit alert rules as if the SLO had burned the given share of its budget")
    public ResponseEntity<ServiceEvaluationResult> simulateBudget(@Valid @RequestBody BudgetSimulationRequest request) {
        String tier = tierOrDefault(request.getTier());
        meterRegistry.counter("api.budgets.simulate.requests", "tier", tier).increment();

        Slo slo = Slo.builder()
                .id(request.getService() + "-" + request.getSloName())
                .service(request.getService())
                .name(request.getSloName())
                .target(request.getTarget())
                .timeWindow(TimeWindow.rolling(request.getWindow()))
                .build();

        ServiceProfile profile = ServiceProfile.builder()
                .service(request.getService())
                .tier(tier)
                .slos(List.of(slo))
                .alertRules(request.getAlertRules())
                .autoRules(request.isAutoRules())
                .build();

        ServiceEvaluationResult result = pipelineService.simulateService(
                profile, request.getBurnPercent(), request.isNotify());
        log.info("Simulated {}% burn for {}: {} alerts, exit code {}",
                request.getBurnPercent(), slo.getId(), result.getAlertsTriggered(), result.getExitCode());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/drift/analyze")
    @Operation(summary = "Analyze budget drift",
            description = "Fits a trend to inline points or to the stored budget history of an SLO")
    public ResponseEntity<DriftResult> analyzeDrift(@Valid @RequestBody DriftAnalysisRequest request) {
        String tier = tierOrDefault(request.getTier());
        meterRegistry.counter("api.drift.analyze.requests", "tier", tier).increment();

        DriftConfig config = DriftConfig.forTier(ServiceTier.fromString(tier));
        if (request.getWindow() != null) {
            config = config.toBuilder().window(request.getWindow()).build();
        }
        if (request.getWarnSlope() != null) {
            config = config.toBuilder().warnSlopePerWeek(parseSlope(request.getWarnSlope())).build();
        }
        if (request.getCriticalSlope() != null) {
            config = config.toBuilder().criticalSlopePerWeek(parseSlope(request.getCriticalSlope())).build();
        }

        String sloName = request.getSloName();
        List<BudgetRatioPoint> points = request.getPoints();
        if (points == null || points.isEmpty()) {
            if (request.getSloId() == null) {
                throw new ValidationException("Either points or sloId is required");
            }
            Slo slo = repository.getSlo(request.getSloId())
                    .orElseThrow(() -> new SloNotFoundException(request.getSloId()));
            Instant end = Instant.now();
            Instant start = end.minus(TimeUtils.parseDuration(config.getWindow()));
            points = repository.getBudgetRatioHistory(slo.getId(), start, end);
            if (sloName == null) {
                sloName = slo.getName();
            }
        }

        return ResponseEntity.ok(driftAnalyzer.analyze(
                request.getService(), tier, sloName != null ? sloName : "default", points, config));
    }

    private static String tierOrDefault(String tier) {
        return tier == null || tier.isBlank() ? ServiceTier.STANDARD.getValue() : tier;
    }

    private static double parseSlope(String value) {
        try {
            return DriftConfig.parseSlopeThreshold(value);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid slope threshold: " + value, e);
        }
    }
}
