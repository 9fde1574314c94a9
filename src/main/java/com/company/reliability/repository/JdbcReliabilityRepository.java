package com.company.reliability.repository;

import com.company.reliability.domain.AlertRule;
import com.company.reliability.domain.BudgetRatioPoint;
import com.company.reliability.domain.Deployment;
import com.company.reliability.domain.ErrorBudget;
import com.company.reliability.domain.ServiceProfile;
import com.company.reliability.domain.Slo;
import com.company.reliability.domain.TimeWindow;
import com.company.reliability.domain.enums.AlertSeverity;
import com.company.reliability.domain.enums.AlertType;
import com.company.reliability.domain.enums.SloStatus;
import com.company.reliability.domain.enums.TimeWindowType;
import com.company.reliability.exception.ValidationException;
import com.company.reliability.util.TimeUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcReliabilityRepository implements ReliabilityRepository {

    private static final TypeReference<Map<String, String>> LABELS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> EXTRA_DATA_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public Slo saveSlo(Slo slo) {
        String sql = """
            INSERT INTO slos (
                id, service, name, description, target, window_duration, window_type,
                query, owner, labels, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NOW(), NOW())
            ON CONFLICT (id) DO UPDATE SET
                service = EXCLUDED.service,
                name = EXCLUDED.name,
                description = EXCLUDED.description,
                target = EXCLUDED.target,
                window_duration = EXCLUDED.window_duration,
                window_type = EXCLUDED.window_type,
                query = EXCLUDED.query,
                owner = EXCLUDED.owner,
                labels = EXCLUDED.labels,
                updated_at = NOW()
            """;

        jdbcTemplate.update(sql,
                slo.getId(),
                slo.getService(),
                slo.getName(),
                slo.getDescription(),
                slo.getTarget(),
                slo.getTimeWindow().getDuration(),
                slo.getTimeWindow().getType().name(),
                slo.getQuery(),
                slo.getOwner(),
                toJson(slo.getLabels())
        );
        return slo;
    }

    @Override
    public Optional<Slo> getSlo(String sloId) {
        String sql = """
            SELECT id, service, name, description, target, window_duration, window_type,
                   query, owner, labels
            FROM slos
            WHERE id = ?
            """;

        List<Slo> results = jdbcTemplate.query(sql, new SloRowMapper(objectMapper), sloId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Slo> getSlosByService(String service) {
        String sql = """
            SELECT id, service, name, description, target, window_duration, window_type,
                   query, owner, labels
            FROM slos
            WHERE service = ?
            ORDER BY name
            """;

        return jdbcTemplate.query(sql, new SloRowMapper(objectMapper), service);
    }

    @Override
    public ErrorBudget createOrUpdateErrorBudget(ErrorBudget budget) {
        if (budget.getUpdatedAt() == null) {
            budget.setUpdatedAt(Instant.now());
        }

        String sql = """
            INSERT INTO error_budgets (
                slo_id, service, period_start, period_end, total_budget_minutes,
                burned_minutes, remaining_minutes, incident_burn_minutes,
                deployment_burn_minutes, slo_breach_burn_minutes, status, burn_rate, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (slo_id, period_start, period_end) DO UPDATE SET
                total_budget_minutes = EXCLUDED.total_budget_minutes,
                burned_minutes = EXCLUDED.burned_minutes,
                remaining_minutes = EXCLUDED.remaining_minutes,
                incident_burn_minutes = EXCLUDED.incident_burn_minutes,
                deployment_burn_minutes = EXCLUDED.deployment_burn_minutes,
                slo_breach_burn_minutes = EXCLUDED.slo_breach_burn_minutes,
                status = EXCLUDED.status,
                burn_rate = EXCLUDED.burn_rate,
                updated_at = EXCLUDED.updated_at
            """;

        jdbcTemplate.update(sql,
                budget.getSloId(),
                budget.getService(),
                Timestamp.from(budget.getPeriodStart()),
                Timestamp.from(budget.getPeriodEnd()),
                budget.getTotalBudgetMinutes(),
                budget.getBurnedMinutes(),
                budget.getRemainingMinutes(),
                budget.getIncidentBurnMinutes(),
                budget.getDeploymentBurnMinutes(),
                budget.getSloBreachBurnMinutes(),
                budget.getStatus().name(),
                budget.getBurnRate(),
                Timestamp.from(budget.getUpdatedAt())
        );

        log.debug("Upserted error budget for SLO {} period {} - {}",
                budget.getSloId(), budget.getPeriodStart(), budget.getPeriodEnd());
        return budget;
    }

    @Override
    public Optional<ErrorBudget> getCurrentErrorBudget(String sloId) {
        String sql = """
            SELECT slo_id, service, period_start, period_end, total_budget_minutes,
                   burned_minutes, remaining_minutes, incident_burn_minutes,
                   deployment_burn_minutes, slo_breach_burn_minutes, status, burn_rate, updated_at
            FROM error_budgets
            WHERE slo_id = ?
            ORDER BY updated_at DESC
            LIMIT 1
            """;

        List<ErrorBudget> results = jdbcTemplate.query(sql, new ErrorBudgetRowMapper(), sloId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public void recordBudgetSnapshot(ErrorBudget budget) {
        String sql = """
            INSERT INTO budget_snapshots (slo_id, recorded_at, burned_minutes, remaining_ratio)
            VALUES (?, ?, ?, ?)
            """;

        double ratio = budget.getTotalBudgetMinutes() > 0
                ? budget.getRemainingMinutes() / budget.getTotalBudgetMinutes()
                : 1.0;

        jdbcTemplate.update(sql,
                budget.getSloId(),
                Timestamp.from(budget.getUpdatedAt() != null ? budget.getUpdatedAt() : Instant.now()),
                budget.getBurnedMinutes(),
                ratio
        );
    }

    @Override
    public double getBurnRateWindow(String sloId, Instant start, Instant end) {
        String sql = """
            SELECT recorded_at, burned_minutes
            FROM budget_snapshots
            WHERE slo_id = ?
            AND recorded_at >= ?
            AND recorded_at <= ?
            ORDER BY recorded_at ASC
            """;

        List<Double> burned = jdbcTemplate.query(sql,
                (rs, rowNum) -> rs.getDouble("burned_minutes"),
                sloId, Timestamp.from(start), Timestamp.from(end));

        double windowMinutes = TimeUtils.minutesBetween(start, end);
        if (burned.size() < 2 || windowMinutes <= 0) {
            return 0.0;
        }

        double oldest = burned.get(0);
        double latest = burned.get(burned.size() - 1);
        // burned resets when a calendar period rolls over
        return Math.max(0.0, latest - oldest) / windowMinutes;
    }

    @Override
    public List<BudgetRatioPoint> getBudgetRatioHistory(String sloId, Instant start, Instant end) {
        String sql = """
            SELECT recorded_at, remaining_ratio
            FROM budget_snapshots
            WHERE slo_id = ?
            AND recorded_at >= ?
            AND recorded_at <= ?
            ORDER BY recorded_at ASC
            """;

        return jdbcTemplate.query(sql,
                (rs, rowNum) -> BudgetRatioPoint.of(
                        rs.getTimestamp("recorded_at").toInstant(),
                        rs.getDouble("remaining_ratio")),
                sloId, Timestamp.from(start), Timestamp.from(end));
    }

    @Override
    public Deployment createDeployment(Deployment deployment) {
        String sql = """
            INSERT INTO deployments (
                id, service, environment, deployed_at, commit_sha, author,
                pr_number, source, extra_data
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id) DO NOTHING
            """;

        int inserted = jdbcTemplate.update(sql,
                deployment.getId(),
                deployment.getService(),
                deployment.getEnvironment(),
                Timestamp.from(deployment.getDeployedAt()),
                deployment.getCommitSha(),
                deployment.getAuthor(),
                deployment.getPrNumber(),
                deployment.getSource(),
                toJson(deployment.getExtraData())
        );

        if (inserted == 0) {
            log.info("Deployment {} already recorded, keeping existing row", deployment.getId());
        }
        return deployment;
    }

    @Override
    public Optional<Deployment> getDeployment(String deploymentId) {
        String sql = """
            SELECT id, service, environment, deployed_at, commit_sha, author, pr_number,
                   source, extra_data, correlated_burn_minutes, correlation_confidence
            FROM deployments
            WHERE id = ?
            """;

        List<Deployment> results = jdbcTemplate.query(sql, new DeploymentRowMapper(objectMapper), deploymentId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Deployment> getRecentDeployments(String service, int hours) {
        String sql = """
            SELECT id, service, environment, deployed_at, commit_sha, author, pr_number,
                   source, extra_data, correlated_burn_minutes, correlation_confidence
            FROM deployments
            WHERE service = ?
            AND deployed_at >= ?
            ORDER BY deployed_at DESC
            """;

        Instant since = Instant.now().minus(hours, ChronoUnit.HOURS);
        return jdbcTemplate.query(sql, new DeploymentRowMapper(objectMapper), service, Timestamp.from(since));
    }

    @Override
    public void updateDeploymentCorrelation(String deploymentId, double burnMinutes, double confidence) {
        String sql = """
            UPDATE deployments
            SET correlated_burn_minutes = ?,
                correlation_confidence = ?
            WHERE id = ?
            """;

        int updated = jdbcTemplate.update(sql, burnMinutes, confidence, deploymentId);
        if (updated == 0) {
            log.warn("No deployment {} to attach correlation to", deploymentId);
        }
    }

    @Override
    public List<AlertRule> getAlertRules(String service) {
        String sql = """
            SELECT id, name, service, slo_id, alert_type, severity, threshold, enabled, channels
            FROM alert_rules
            WHERE service = ?
            ORDER BY id
            """;

        return jdbcTemplate.query(sql, new AlertRuleRowMapper(), service);
    }

    @Override
    public List<ServiceProfile> findServiceProfiles() {
        String sql = """
            SELECT service, tier, team, auto_rules, default_channels
            FROM service_profiles
            ORDER BY service
            """;

        List<ServiceProfile> profiles = jdbcTemplate.query(sql, (rs, rowNum) -> ServiceProfile.builder()
                .service(rs.getString("service"))
                .tier(rs.getString("tier"))
                .team(rs.getString("team"))
                .autoRules(rs.getBoolean("auto_rules"))
                .defaultChannels(splitList(rs.getString("default_channels")))
                .build());

        for (ServiceProfile profile : profiles) {
            profile.setSlos(getSlosByService(profile.getService()));
            profile.setAlertRules(getAlertRules(profile.getService()));
        }
        return profiles;
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Cannot serialize value for storage", e);
        }
    }

    private static <T> T fromJson(ObjectMapper objectMapper, String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable JSON column: {}", e.getOriginalMessage());
            return fallback;
        }
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return new ArrayList<>();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    @RequiredArgsConstructor
    private static class SloRowMapper implements RowMapper<Slo> {
        private final ObjectMapper objectMapper;

        @Override
        public Slo mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Slo.builder()
                    .id(rs.getString("id"))
                    .service(rs.getString("service"))
                    .name(rs.getString("name"))
                    .description(rs.getString("description"))
                    .target(rs.getDouble("target"))
                    .timeWindow(new TimeWindow(
                            rs.getString("window_duration"),
                            TimeWindowType.fromString(rs.getString("window_type"))))
                    .query(rs.getString("query"))
                    .owner(rs.getString("owner"))
                    .labels(fromJson(objectMapper, rs.getString("labels"), LABELS_TYPE, new HashMap<>()))
                    .build();
        }
    }

    private static class ErrorBudgetRowMapper implements RowMapper<ErrorBudget> {
        @Override
        public ErrorBudget mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ErrorBudget.builder()
                    .sloId(rs.getString("slo_id"))
                    .service(rs.getString("service"))
                    .periodStart(toInstant(rs.getTimestamp("period_start")))
                    .periodEnd(toInstant(rs.getTimestamp("period_end")))
                    .totalBudgetMinutes(rs.getDouble("total_budget_minutes"))
                    .burnedMinutes(rs.getDouble("burned_minutes"))
                    .remainingMinutes(rs.getDouble("remaining_minutes"))
                    .incidentBurnMinutes(rs.getDouble("incident_burn_minutes"))
                    .deploymentBurnMinutes(rs.getDouble("deployment_burn_minutes"))
                    .sloBreachBurnMinutes(rs.getDouble("slo_breach_burn_minutes"))
                    .status(SloStatus.fromString(rs.getString("status")))
                    .burnRate(rs.getObject("burn_rate", Double.class))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
        }
    }

    @RequiredArgsConstructor
    private static class DeploymentRowMapper implements RowMapper<Deployment> {
        private final ObjectMapper objectMapper;

        @Override
        public Deployment mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Deployment.builder()
                    .id(rs.getString("id"))
                    .service(rs.getString("service"))
                    .environment(rs.getString("environment"))
                    .deployedAt(toInstant(rs.getTimestamp("deployed_at")))
                    .commitSha(rs.getString("commit_sha"))
                    .author(rs.getString("author"))
                    .prNumber(rs.getObject("pr_number", Integer.class))
                    .source(rs.getString("source"))
                    .extraData(fromJson(objectMapper, rs.getString("extra_data"), EXTRA_DATA_TYPE, new HashMap<>()))
                    .correlatedBurnMinutes(rs.getObject("correlated_burn_minutes", Double.class))
                    .correlationConfidence(rs.getObject("correlation_confidence", Double.class))
                    .build();
        }
    }

    private static class AlertRuleRowMapper implements RowMapper<AlertRule> {
        @Override
        public AlertRule mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AlertRule.builder()
                    .id(rs.getString("id"))
                    .name(rs.getString("name"))
                    .service(rs.getString("service"))
                    .sloId(rs.getString("slo_id"))
                    .alertType(AlertType.fromString(rs.getString("alert_type")))
                    .severity(AlertSeverity.fromString(rs.getString("severity")))
                    .threshold(rs.getDouble("threshold"))
                    .enabled(rs.getBoolean("enabled"))
                    .channels(splitList(rs.getString("channels")))
                    .build();
        }
    }
}
