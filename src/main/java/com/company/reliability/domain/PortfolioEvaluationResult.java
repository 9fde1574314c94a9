package com.company.reliability.domain;

import com.company.reliability.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioEvaluationResult {
    private Instant evaluatedAt;

    @Builder.Default
    private List<ServiceEvaluationResult> results = new ArrayList<>();

    public Severity getWorstSeverity() {
        return Severity.worstOf(results.stream()
                .map(ServiceEvaluationResult::getWorstSeverity)
                .collect(Collectors.toList()));
    }

    public int getExitCode() {
        return getWorstSeverity().getExitCode();
    }

    public List<String> getFailedServices() {
        return results.stream()
                .filter(result -> !result.isSuccessful())
                .map(ServiceEvaluationResult::getService)
                .collect(Collectors.toList());
    }

    public int getTotalAlerts() {
        return results.stream().mapToInt(ServiceEvaluationResult::getAlertsTriggered).sum();
    }
}
