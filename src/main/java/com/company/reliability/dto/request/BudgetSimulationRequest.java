package com.company.reliability.dto.request;

import com.company.reliability.domain.AlertRule;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
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
public class BudgetSimulationRequest {

    @NotBlank(message = "Service is required")
    private String service;

    @Builder.Default
    private String tier = "standard";

    @NotBlank(message = "SLO name is required")
    private String sloName;

    @Positive(message = "Target must be positive")
    private double target;

    @Builder.Default
    private String window = "30d";

    @DecimalMin(value = "0.0", message = "Burn percent must not be negative")
    @DecimalMax(value = "1000.0", message = "Burn percent is unreasonably large")
    private double burnPercent;

    @Builder.Default
    private List<AlertRule> alertRules = new ArrayList<>();

    @Builder.Default
    private boolean autoRules = true;

    @Builder.Default
    private boolean notify = false;
}
