package com.company.reliability.domain;

import com.company.reliability.domain.enums.DriftPattern;
import com.company.reliability.domain.enums.DriftSeverity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class DriftResult {
    String service;
    String tier;
    String sloName;
    String window;
    Instant analyzedAt;
    Instant dataStart;
    Instant dataEnd;
    DriftMetrics metrics;
    DriftProjection projection;
    DriftPattern pattern;
    DriftSeverity severity;
    String summary;
    String recommendation;

    public int getExitCode() {
        return severity.getExitCode();
    }
}
