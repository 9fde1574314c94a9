package com.company.reliability.service;

import com.company.reliability.domain.DownstreamService;
import com.company.reliability.domain.GateCheckResult;
import com.company.reliability.domain.GateCondition;
import com.company.reliability.domain.GateException;
import com.company.reliability.domain.GatePolicy;
import com.company.reliability.domain.enums.GateDecision;
import com.company.reliability.dto.request.GateCheckRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DeploymentGate")
class DeploymentGateTest {

    private DeploymentGate gate;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        gate = new DeploymentGate(new PolicyConditionEvaluator(), meterRegistry);
    }

    @Nested
    @DisplayName("Critical tier")
    class CriticalTier {

        @Test
        @DisplayName("Should approve with plenty of budget left")
        void shouldApproveHealthyBudget() {
            GateCheckResult result = gate.checkDeployment("payments", "critical", 1440, 50, null, null, null);

            assertThat(result.getResult()).isEqualTo(GateDecision.APPROVED);
            assertThat(result.getBlockingThreshold()).isEqualTo(10.0);
            assertThat(result.getWarningThreshold()).isEqualTo(20.0);
            assertThat(result.getExitCode()).isZero();
        }

        @Test
        @DisplayName("Should warn between the warning and blocking thresholds")
        void shouldWarnOnLowBudget() {
            GateCheckResult result = gate.checkDeployment("payments", "critical", 1440, 1200, null, null, null);

            assertThat(result.getResult()).isEqualTo(GateDecision.WARNING);
            assertThat(result.getBudgetRemainingMinutes()).isEqualTo(240.0);
            assertThat(result.getExitCode()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should block below the blocking threshold")
        void shouldBlockExhaustedBudget() {
            GateCheckResult result = gate.checkDeployment("payments", "critical", 1440, 1350, null, null, null);

            assertThat(result.getResult()).isEqualTo(GateDecision.BLOCKED);
            assertThat(result.isBlocked()).isTrue();
            assertThat(result.getExitCode()).isEqualTo(2);
            assertThat(result.getMessage()).startsWith("Deployment BLOCKED");
            assertThat(meterRegistry.counter("reliability.gate.decisions",
                    "tier", "critical", "result", "BLOCKED").count()).isEqualTo(1.0);
        }
    }

    @ParameterizedTest(name = "standard tier with {0} minutes consumed is never blocked")
    @ValueSource(doubles = {0, 500, 1200, 1400, 1440, 2000})
    void shouldNeverBlockStandardTier(double consumed) {
        GateCheckResult result = gate.checkDeployment("search", "standard", 1440, consumed, null, null, null);

        assertThat(result.getBlockingThreshold()).isNull();
        assertThat(result.getResult()).isIn(GateDecision.APPROVED, GateDecision.WARNING);
    }

    @Test
    @DisplayName("Should approve when no budget data exists")
    void shouldApproveWithoutBudget() {
        GateCheckResult result = gate.checkDeployment("payments", "critical", 0, 0, null, null, null);

        assertThat(result.getResult()).isEqualTo(GateDecision.APPROVED);
        assertThat(result.getBudgetRemainingPercentage()).isEqualTo(100.0);
    }

    @Nested
    @DisplayName("Team exceptions")
    class TeamExceptions {

        private final GatePolicy policy = GatePolicy.builder()
                .exceptions(List.of(new GateException("platform-team", GateException.ALLOW_ALWAYS)))
                .build();

        @Test
        @DisplayName("Should bypass a block for the exact team")
        void shouldBypassForExactTeam() {
            GateCheckResult result = gate.checkDeployment("payments", "critical", 1440, 1350, null,
                    "platform-team", policy);

            assertThat(result.getResult()).isEqualTo(GateDecision.APPROVED);
            assertThat(result.getBypassedBy()).isEqualTo("platform-team");
        }

        @Test
        @DisplayName("Should not bypass for a different team")
        void shouldNotBypassForOtherTeam() {
            GateCheckResult result = gate.checkDeployment("payments", "critical", 1440, 1350, null,
                    "Platform-Team", policy);

            assertThat(result.getResult()).isEqualTo(GateDecision.BLOCKED);
            assertThat(result.getBypassedBy()).isNull();
        }

        @Test
        @DisplayName("Should not bypass unless allow is always")
        void shouldRequireAllowAlways() {
            GatePolicy weak = GatePolicy.builder()
                    .exceptions(List.of(new GateException("platform-team", "sometimes")))
                    .build();

            GateCheckResult result = gate.checkDeployment("payments", "critical", 1440, 1350, null,
                    "platform-team", weak);

            assertThat(result.getResult()).isEqualTo(GateDecision.BLOCKED);
        }
    }

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        @DisplayName("Should replace the blocking threshold with the first matching condition")
        void shouldApplyFirstMatchingCondition() {
            GatePolicy policy = GatePolicy.builder()
                    .conditions(List.of(
                            new GateCondition("prod-strict", "env == 'prod' AND budget_remaining < 50", 40.0),
                            new GateCondition("never", "tier == 'low'", 99.0)))
                    .build();
            GateCheckRequest request = GateCheckRequest.builder()
                    .service("search")
                    .tier("standard")
                    .budgetTotalMinutes(1000)
                    .budgetConsumedMinutes(700)
                    .environment("prod")
                    .policy(policy)
                    .build();

            GateCheckResult result = gate.checkDeployment(request);

            assertThat(result.getMatchedCondition()).isEqualTo("prod-strict");
            assertThat(result.getBlockingThreshold()).isEqualTo(40.0);
            assertThat(result.getResult()).isEqualTo(GateDecision.BLOCKED);
        }

        @Test
        @DisplayName("Should skip invalid conditions")
        void shouldSkipInvalidConditions() {
            GatePolicy policy = GatePolicy.builder()
                    .conditions(List.of(new GateCondition("broken", "no_such_variable > 1", 90.0)))
                    .build();

            GateCheckResult result = gate.checkDeployment("search", "standard", 1000, 100, null, null, policy);

            assertThat(result.getMatchedCondition()).isNull();
            assertThat(result.getResult()).isEqualTo(GateDecision.APPROVED);
            assertThat(meterRegistry.counter("reliability.gate.invalid_conditions").count()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Should let custom thresholds replace the tier defaults")
    void shouldUseCustomThresholds() {
        GatePolicy policy = GatePolicy.builder().warning(60.0).blocking(50.0).build();

        GateCheckResult result = gate.checkDeployment("search", "standard", 1000, 600, null, null, policy);

        assertThat(result.getResult()).isEqualTo(GateDecision.BLOCKED);
        assertThat(result.getWarningThreshold()).isEqualTo(60.0);
    }

    @Test
    @DisplayName("Should describe the blast radius of high-criticality dependents")
    void shouldDescribeBlastRadius() {
        List<DownstreamService> downstream = List.of(
                new DownstreamService("checkout", "critical"),
                new DownstreamService("reports", "low"));

        GateCheckResult result = gate.checkDeployment("payments", "critical", 1440, 50, downstream, null, null);

        assertThat(result.getHighCriticalityDownstream()).containsExactly("checkout");
        assertThat(result.getDownstreamServices()).containsExactly("checkout", "reports");
        assertThat(result.getRecommendations()).anyMatch(r -> r.startsWith("Blast radius: 1 high-criticality"));
    }
}
