package com.company.reliability.scheduled;

import com.company.reliability.domain.AlertEvent;
import com.company.reliability.domain.PortfolioEvaluationResult;
import com.company.reliability.domain.ServiceEvaluationResult;
import com.company.reliability.domain.ServiceProfile;
import com.company.reliability.domain.enums.AlertSeverity;
import com.company.reliability.domain.enums.Severity;
import com.company.reliability.exception.ProviderQueryException;
import com.company.reliability.repository.ReliabilityRepository;
import com.company.reliability.service.AlertPipelineService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BudgetEvaluationJob")
class BudgetEvaluationJobTest {

    @Mock
    private ReliabilityRepository repository;

    @Mock
    private AlertPipelineService pipelineService;

    private SimpleMeterRegistry meterRegistry;
    private BudgetEvaluationJob job;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        job = new BudgetEvaluationJob(repository, pipelineService, meterRegistry);
        ReflectionTestUtils.setField(job, "dispatch", true);
    }

    @Test
    @DisplayName("Should publish the portfolio's worst severity as a gauge")
    void shouldPublishWorstSeverity() {
        // Given
        List<ServiceProfile> profiles = List.of(ServiceProfile.builder().service("checkout").tier("critical").build());
        AlertEvent critical = AlertEvent.builder()
                .id("evt-1")
                .service("checkout")
                .sloId("checkout-availability")
                .severity(AlertSeverity.CRITICAL)
                .triggeredAt(Instant.parse("2024-06-10T12:00:00Z"))
                .build();
        PortfolioEvaluationResult portfolio = PortfolioEvaluationResult.builder()
                .results(List.of(ServiceEvaluationResult.builder()
                        .service("checkout")
                        .events(List.of(critical))
                        .build()))
                .build();
        when(repository.findServiceProfiles()).thenReturn(profiles);
        when(pipelineService.evaluatePortfolio(profiles, true)).thenReturn(portfolio);

        // When
        job.evaluateBudgets();

        // Then
        assertThat(meterRegistry.get("reliability.portfolio.worst_severity").gauge().value())
                .isEqualTo(Severity.CRITICAL.getLevel());
        assertThat(meterRegistry.find("reliability.evaluation.job_failures").counter()).isNull();
    }

    @Test
    @DisplayName("Should count a failed run without propagating it")
    void shouldCountFailures() {
        when(repository.findServiceProfiles()).thenThrow(new ProviderQueryException("database unavailable"));

        job.evaluateBudgets();

        assertThat(meterRegistry.get("reliability.evaluation.job_failures").counter().count()).isEqualTo(1.0);
        verify(pipelineService, never()).evaluatePortfolio(anyList(), anyBoolean());
    }

    @Test
    @DisplayName("Should skip evaluation when no services are registered")
    void shouldSkipWithoutProfiles() {
        when(repository.findServiceProfiles()).thenReturn(List.of());

        job.evaluateBudgets();

        verify(pipelineService, never()).evaluatePortfolio(anyList(), anyBoolean());
        assertThat(meterRegistry.find("reliability.portfolio.worst_severity").gauge()).isNull();
    }
}
