package com.company.reliability.domain;

import com.company.reliability.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceEvaluationResult {
    private String service;
    private int budgetsEvaluated;
    private int rulesEvaluated;
    private int alertsTriggered;
    private int notificationsSent;

    @Builder.Default
    private List<AlertEvent> events = new ArrayList<>();
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    @Builder.Default
    private List<ErrorBudget> budgets = new ArrayList<>();
    @Builder.Default
    private List<Map<String, ChannelDeliveryResult>> deliveries = new ArrayList<>();

    public static ServiceEvaluationResult failed(String service, String error) {
        ServiceEvaluationResult result = ServiceEvaluationResult.builder().service(service).build();
        result.getErrors().add(error);
        return result;
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }

    public Severity getWorstSeverity() {
        return Severity.worstOf(events.stream()
                .map(event -> event.getSeverity().toSeverity())
                .collect(Collectors.toList()));
    }

    public int getExitCode() {
        return getWorstSeverity().getExitCode();
    }
}
