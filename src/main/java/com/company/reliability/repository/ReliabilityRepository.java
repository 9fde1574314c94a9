package com.company.reliability.repository;

import com.company.reliability.domain.AlertRule;
import com.company.reliability.domain.BudgetRatioPoint;
import com.company.reliability.domain.Deployment;
import com.company.reliability.domain.ErrorBudget;
import com.company.reliability.domain.ServiceProfile;
import com.company.reliability.domain.Slo;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage seam for the engine. Implementations own upsert atomicity for
 * error budgets and deployment correlation fields.
 */
public interface ReliabilityRepository {

    Slo saveSlo(Slo slo);

    Optional<Slo> getSlo(String sloId);

    List<Slo> getSlosByService(String service);

    /**
     * Upsert keyed by (sloId, periodStart, periodEnd).
     */
    ErrorBudget createOrUpdateErrorBudget(ErrorBudget budget);

    Optional<ErrorBudget> getCurrentErrorBudget(String sloId);

    void recordBudgetSnapshot(ErrorBudget budget);

    /**
     * Budget minutes burned per minute between {@code start} and {@code end},
     * derived from recorded snapshots. 0 when fewer than two snapshots fall
     * in the window.
     */
    double getBurnRateWindow(String sloId, Instant start, Instant end);

    List<BudgetRatioPoint> getBudgetRatioHistory(String sloId, Instant start, Instant end);

    Deployment createDeployment(Deployment deployment);

    Optional<Deployment> getDeployment(String deploymentId);

    List<Deployment> getRecentDeployments(String service, int hours);

    void updateDeploymentCorrelation(String deploymentId, double burnMinutes, double confidence);

    List<AlertRule> getAlertRules(String service);

    List<ServiceProfile> findServiceProfiles();
}
