package com.company.reliability.service;

import com.company.reliability.domain.AlertRule;
import com.company.reliability.domain.enums.AlertSeverity;
import com.company.reliability.domain.enums.AlertType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TierAlertRules")
class TierAlertRulesTest {

    private final TierAlertRules tierAlertRules = new TierAlertRules();

    @Test
    @DisplayName("Should give critical services four default rules")
    void shouldGiveCriticalDefaults() {
        List<AlertRule> rules = tierAlertRules.defaultRules("payments", "critical", "payments-availability",
                List.of("log"));

        assertThat(rules).extracting(AlertRule::getName)
                .containsExactly("budget-warning", "budget-critical", "burn-rate-warning", "budget-exhaustion");
        assertThat(rules).extracting(AlertRule::getThreshold).containsExactly(0.75, 0.90, 3.0, 12.0);
        assertThat(rules.get(0).getId()).isEqualTo("payments-payments-availability-budget-warning");
        assertThat(rules).allSatisfy(rule -> assertThat(rule.getChannels()).containsExactly("log"));
    }

    @Test
    @DisplayName("Should give low tier services a single critical rule")
    void shouldGiveLowTierSingleRule() {
        List<AlertRule> rules = tierAlertRules.defaultRules("docs", "LOW", "docs-availability", null);

        assertThat(rules).hasSize(1);
        assertThat(rules.get(0).getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(rules.get(0).getThreshold()).isEqualTo(0.95);
    }

    @Test
    @DisplayName("Should give unknown tiers no default rules")
    void shouldIgnoreUnknownTier() {
        assertThat(tierAlertRules.defaultRules("svc", "platinum", "svc-slo", null)).isEmpty();
        assertThat(tierAlertRules.defaultRules("svc", null, "svc-slo", null)).isEmpty();
    }

    @Test
    @DisplayName("Should expand wildcard rules per SLO and keep explicit overrides")
    void shouldExpandWildcardsAndRespectOverrides() {
        // Given: a wildcard budget-warning at 60% replaces the tier's 80%
        AlertRule wildcard = AlertRule.builder()
                .name("budget-warning")
                .service("checkout")
                .sloId(AlertRule.ALL_SLOS)
                .alertType(AlertType.BUDGET_THRESHOLD)
                .threshold(0.6)
                .severity(AlertSeverity.WARNING)
                .build();

        // When
        List<AlertRule> rules = tierAlertRules.resolveEffectiveRules("checkout", "standard", List.of(wildcard),
                List.of("availability", "latency"), true, new ArrayList<>());

        // Then: 2 expanded + (budget-critical, burn-rate-warning) x 2 SLOs
        assertThat(rules).hasSize(6);
        assertThat(rules).filteredOn(rule -> "budget-warning".equals(rule.getName()))
                .extracting(AlertRule::getThreshold)
                .containsOnly(0.6);
        assertThat(rules).extracting(AlertRule::getId)
                .contains("checkout-availability-budget-warning", "checkout-latency-budget-warning");
        assertThat(rules).noneMatch(AlertRule::isWildcard);
    }

    @Test
    @DisplayName("Should order tier defaults by rule, then by SLO")
    void shouldOrderDefaultsByTemplateThenSlo() {
        List<AlertRule> rules = tierAlertRules.resolveEffectiveRules("checkout", "standard", List.of(),
                List.of("availability", "latency"), true, new ArrayList<>());

        assertThat(rules).extracting(AlertRule::getId).containsExactly(
                "checkout-availability-budget-warning",
                "checkout-latency-budget-warning",
                "checkout-availability-budget-critical",
                "checkout-latency-budget-critical",
                "checkout-availability-burn-rate-warning",
                "checkout-latency-burn-rate-warning");
    }

    @Test
    @DisplayName("Should use only explicit rules when auto rules are off")
    void shouldHonourAutoRulesOff() {
        AlertRule explicit = AlertRule.builder()
                .id("custom")
                .name("custom")
                .service("checkout")
                .sloId("availability")
                .alertType(AlertType.BUDGET_THRESHOLD)
                .threshold(0.5)
                .severity(AlertSeverity.INFO)
                .build();

        List<AlertRule> rules = tierAlertRules.resolveEffectiveRules("checkout", "critical", List.of(explicit),
                List.of("availability"), false, null);

        assertThat(rules).containsExactly(explicit);
    }
}
