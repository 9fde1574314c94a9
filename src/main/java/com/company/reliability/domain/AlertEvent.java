package com.company.reliability.domain;

import com.company.reliability.domain.enums.AlertSeverity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class AlertEvent {
    String id;
    String ruleId;
    String service;
    String sloId;
    AlertSeverity severity;
    String title;
    String message;
    Map<String, Object> details;
    Instant triggeredAt;
}
