package com.company.reliability.service;

import com.company.reliability.domain.AlertRule;
import com.company.reliability.domain.enums.AlertSeverity;
import com.company.reliability.domain.enums.AlertType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tier-driven default alert rules and wildcard expansion.
 */
@Component
@Slf4j
public class TierAlertRules {

    private static final Map<String, List<RuleTemplate>> TIER_DEFAULTS = new LinkedHashMap<>();

    static {
        TIER_DEFAULTS.put("critical", List.of(
                new RuleTemplate("budget-warning", AlertType.BUDGET_THRESHOLD, 0.75, AlertSeverity.WARNING),
                new RuleTemplate("budget-critical", AlertType.BUDGET_THRESHOLD, 0.90, AlertSeverity.CRITICAL),
                new RuleTemplate("burn-rate-warning", AlertType.BURN_RATE, 3.0, AlertSeverity.WARNING),
                new RuleTemplate("budget-exhaustion", AlertType.BUDGET_EXHAUSTION, 12.0, AlertSeverity.CRITICAL)));
        TIER_DEFAULTS.put("high", List.of(
                new RuleTemplate("budget-warning", AlertType.BUDGET_THRESHOLD, 0.65, AlertSeverity.WARNING),
                new RuleTemplate("budget-critical", AlertType.BUDGET_THRESHOLD, 0.85, AlertSeverity.CRITICAL),
                new RuleTemplate("burn-rate-warning", AlertType.BURN_RATE, 3.0, AlertSeverity.WARNING),
                new RuleTemplate("budget-exhaustion", AlertType.BUDGET_EXHAUSTION, 6.0, AlertSeverity.CRITICAL)));
        TIER_DEFAULTS.put("standard", List.of(
                new RuleTemplate("budget-warning", AlertType.BUDGET_THRESHOLD, 0.80, AlertSeverity.WARNING),
                new RuleTemplate("budget-critical", AlertType.BUDGET_THRESHOLD, 0.95, AlertSeverity.CRITICAL),
                new RuleTemplate("burn-rate-warning", AlertType.BURN_RATE, 5.0, AlertSeverity.WARNING)));
        TIER_DEFAULTS.put("low", List.of(
                new RuleTemplate("budget-critical", AlertType.BUDGET_THRESHOLD, 0.95, AlertSeverity.CRITICAL)));
    }

    /**
     * Default rules for one SLO of a service. Unknown tiers get none.
     */
    public List<AlertRule> defaultRules(String service, String tier, String sloId, List<String> channels) {
        List<RuleTemplate> templates = templatesFor(tier);
        List<AlertRule> rules = new ArrayList<>();
        for (RuleTemplate template : templates) {
            rules.add(template.toRule(service, sloId, channels));
        }
        return rules;
    }

    /**
     * Expands wildcard rules into one concrete rule per SLO and, when
     * {@code autoRules} is set, adds tier defaults for every (rule name, SLO)
     * pair the explicit rules do not already cover.
     */
    public List<AlertRule> resolveEffectiveRules(String service, String tier, List<AlertRule> explicitRules,
                                                 List<String> sloIds, boolean autoRules, List<String> channels) {
        List<AlertRule> effective = new ArrayList<>();
        Set<String> covered = new HashSet<>();

        for (AlertRule rule : explicitRules == null ? Collections.<AlertRule>emptyList() : explicitRules) {
            if (rule.isWildcard()) {
                for (String sloId : sloIds) {
                    AlertRule concrete = rule.toBuilder()
                            .sloId(sloId)
                            .id(ruleId(service, sloId, rule.getName()))
                            .build();
                    effective.add(concrete);
                    covered.add(coverageKey(rule.getName(), sloId));
                }
            } else {
                effective.add(rule);
                covered.add(coverageKey(rule.getName(), rule.getSloId()));
            }
        }

        if (autoRules) {
            int added = 0;
            for (RuleTemplate template : templatesFor(tier)) {
                for (String sloId : sloIds) {
                    if (covered.add(coverageKey(template.name, sloId))) {
                        effective.add(template.toRule(service, sloId, channels));
                        added++;
                    }
                }
            }
            log.debug("Added {} tier '{}' default rules for service {}", added, tier, service);
        }

        return effective;
    }

    static String ruleId(String service, String sloId, String name) {
        return service + "-" + sloId + "-" + name;
    }

    private static String coverageKey(String name, String sloId) {
        return name + "|" + sloId;
    }

    private static List<RuleTemplate> templatesFor(String tier) {
        if (tier == null) {
            return Collections.emptyList();
        }
        return TIER_DEFAULTS.getOrDefault(tier.toLowerCase(Locale.ROOT), Collections.emptyList());
    }

    private static class RuleTemplate {
        private final String name;
        private final AlertType type;
        private final double threshold;
        private final AlertSeverity severity;

        RuleTemplate(String name, AlertType type, double threshold, AlertSeverity severity) {
            this.name = name;
            this.type = type;
            this.threshold = threshold;
            this.severity = severity;
        }

        AlertRule toRule(String service, String sloId, List<String> channels) {
            return AlertRule.builder()
                    .id(ruleId(service, sloId, name))
                    .name(name)
                    .service(service)
                    .sloId(sloId)
                    .alertType(type)
                    .severity(severity)
                    .threshold(threshold)
                    .enabled(true)
                    .channels(channels == null ? new ArrayList<>() : new ArrayList<>(channels))
                    .build();
        }
    }
}
