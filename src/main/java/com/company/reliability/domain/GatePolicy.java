package com.company.reliability.domain;

import com.company.reliability.domain.enums.ServiceTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Remaining-budget thresholds in percent. A null {@code blocking} means the
 * gate is advisory only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatePolicy {
    private Double warning;
    private Double blocking;

    @Builder.Default
    private List<GateCondition> conditions = new ArrayList<>();

    @Builder.Default
    private List<GateException> exceptions = new ArrayList<>();

    public static GatePolicy forTier(ServiceTier tier) {
        if (tier == ServiceTier.CRITICAL) {
            return GatePolicy.builder().warning(20.0).blocking(10.0).build();
        }
        if (tier == ServiceTier.LOW) {
            return GatePolicy.builder().warning(30.0).blocking(null).build();
        }
        return GatePolicy.builder().warning(20.0).blocking(null).build();
    }
}
