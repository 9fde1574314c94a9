package com.company.reliability.controller;

import com.company.reliability.exception.GlobalExceptionHandler;
import com.company.reliability.service.DeploymentGate;
import com.company.reliability.service.PolicyConditionEvaluator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("DeploymentGateController")
class DeploymentGateControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        DeploymentGate gate = new DeploymentGate(new PolicyConditionEvaluator(), new SimpleMeterRegistry());
        mockMvc = MockMvcBuilders.standaloneSetup(new DeploymentGateController(gate))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should return the gate decision with its exit code")
    void shouldReturnDecision() throws Exception {
        mockMvc.perform(post("/api/v1/gates/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "service": "payments",
                                  "tier": "critical",
                                  "budgetTotalMinutes": 1440,
                                  "budgetConsumedMinutes": 1350,
                                  "downstreamServices": [{"name": "checkout", "criticality": "critical"}]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("BLOCKED"))
                .andExpect(jsonPath("$.exitCode").value(2))
                .andExpect(jsonPath("$.blockingThreshold").value(10.0))
                .andExpect(jsonPath("$.highCriticalityDownstream[0]").value("checkout"));
    }

    @Test
    @DisplayName("Should reject a request without a service")
    void shouldRejectMissingService() throws Exception {
        mockMvc.perform(post("/api/v1/gates/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"budgetTotalMinutes\": 1440, \"budgetConsumedMinutes\": 10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.service").value("Service is required"));
    }
}
