package com.company.reliability.dto.request;

import com.company.reliability.domain.DownstreamService;
import com.company.reliability.domain.GatePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
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
public class GateCheckRequest {

    @NotBlank(message = "Service is required")
    private String service;

    @Builder.Default
    private String tier = "standard";

    @PositiveOrZero(message = "Budget total must not be negative")
    private double budgetTotalMinutes;

    @PositiveOrZero(message = "Budget consumed must not be negative")
    private double budgetConsumedMinutes;

    @Valid
    @Builder.Default
    private List<DownstreamService> downstreamServices = new ArrayList<>();

    private String team;

    private String environment;

    private Double burnRate;

    @Valid
    private GatePolicy policy;
}
