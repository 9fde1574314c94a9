package com.company.reliability.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the pipeline needs to know about one service: its tier, SLOs and
 * declared alert rules.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceProfile {
    private String service;
    private String tier;
    private String team;

    @Builder.Default
    private List<Slo> slos = new ArrayList<>();

    @Builder.Default
    private List<AlertRule> alertRules = new ArrayList<>();

    @Builder.Default
    private boolean autoRules = true;

    @Builder.Default
    private List<String> defaultChannels = new ArrayList<>();
}
