package com.company.reliability.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Deployment {
    private String id;
    private String service;
    private String environment;
    private Instant deployedAt;
    private String commitSha;
    private String author;
    private Integer prNumber;
    private String source;

    @Builder.Default
    private Map<String, Object> extraData = new HashMap<>();

    // written back by the correlator
    private Double correlatedBurnMinutes;
    private Double correlationConfidence;
}
