package com.company.reliability.domain;

import com.company.reliability.domain.enums.AlertSeverity;
import com.company.reliability.domain.enums.AlertType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Threshold semantics by type: BUDGET_THRESHOLD is a consumed fraction
 * (0.75 = 75%), BURN_RATE a multiple of the sustainable rate, and
 * BUDGET_EXHAUSTION a number of hours.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {
    public static final String ALL_SLOS = "*";

    private String id;
    private String name;
    private String service;
    private String sloId;
    private AlertType alertType;
    private AlertSeverity severity;
    private double threshold;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private List<String> channels = new ArrayList<>();

    public boolean isWildcard() {
        return ALL_SLOS.equals(sloId);
    }

    public boolean appliesTo(ErrorBudget budget) {
        if (!enabled || budget == null) {
            return false;
        }
        if (service == null || !service.equals(budget.getService())) {
            return false;
        }
        return isWildcard() || (sloId != null && sloId.equals(budget.getSloId()));
    }
}
