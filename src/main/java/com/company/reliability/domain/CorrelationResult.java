package com.company.reliability.domain;

import com.company.reliability.domain.enums.ConfidenceLevel;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CorrelationResult {
    String deploymentId;
    String service;
    String sloId;
    double burnMinutes;
    double confidence;
    String method;
    Map<String, Object> details;

    public ConfidenceLevel getConfidenceLabel() {
        return ConfidenceLevel.fromConfidence(confidence);
    }
}
