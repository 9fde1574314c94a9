package com.company.reliability.domain;

import com.company.reliability.domain.enums.GateDecision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GateCheckResult {
    private String service;
    private String tier;
    private GateDecision result;
    private double budgetTotalMinutes;
    private double budgetConsumedMinutes;
    private double budgetRemainingMinutes;
    private double budgetRemainingPercentage;
    private Double warningThreshold;
    private Double blockingThreshold;
    private String matchedCondition;
    private String bypassedBy;

    @Builder.Default
    private List<String> downstreamServices = new ArrayList<>();
    @Builder.Default
    private List<String> highCriticalityDownstream = new ArrayList<>();

    private String message;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    public int getExitCode() {
        return result == null ? 0 : result.getExitCode();
    }

    public boolean isBlocked() {
        return result == GateDecision.BLOCKED;
    }
}
