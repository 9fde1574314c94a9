package com.company.reliability.dto.request;

import com.company.reliability.domain.BudgetRatioPoint;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Either {@code points} are supplied inline or, when empty, the history of
 * {@code sloId} is loaded from the repository.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftAnalysisRequest {

    @NotBlank(message = "Service is required")
    private String service;

    @Builder.Default
    private String tier = "standard";

    private String sloId;

    private String sloName;

    private String window;

    /** Optional override such as {@code -0.5%/week}. */
    private String warnSlope;

    private String criticalSlope;

    @Builder.Default
    private List<BudgetRatioPoint> points = new ArrayList<>();
}
