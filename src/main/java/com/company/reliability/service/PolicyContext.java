package com.company.reliability.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Variables visible to gate policy conditions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PolicyContext {
    private double budgetRemaining;
    private double budgetConsumed;
    private Double burnRate;
    private String tier;
    private String environment;
    private String service;
    private String team;
    private int downstreamCount;
    private int highCriticalityDownstream;

    @Builder.Default
    private ZonedDateTime now = ZonedDateTime.now(ZoneOffset.UTC);

    public Map<String, Object> toVariables() {
        Map<String, Object> variables = new HashMap<>();
        variables.put("budget_remaining", budgetRemaining);
        variables.put("budget_consumed", budgetConsumed);
        variables.put("burn_rate", burnRate != null ? burnRate : 0.0);
        variables.put("tier", tier != null ? tier : "");
        variables.put("environment", environment != null ? environment : "");
        variables.put("env", environment != null ? environment : "");
        variables.put("service", service != null ? service : "");
        variables.put("team", team != null ? team : "");
        variables.put("downstream_count", downstreamCount);
        variables.put("high_criticality_downstream", highCriticalityDownstream);
        variables.put("hour", now.getHour());
        variables.put("minute", now.getMinute());
        variables.put("weekday", isWeekday());
        // 0 = Monday
        variables.put("day_of_week", now.getDayOfWeek().getValue() - 1);
        variables.put("date", now.toLocalDate().toString());
        variables.put("month", now.getMonthValue());
        variables.put("day", now.getDayOfMonth());
        variables.put("year", now.getYear());
        return variables;
    }

    public boolean isWeekday() {
        DayOfWeek day = now.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    /**
     * Monday to Friday, 09:00 to 17:00.
     */
    public boolean isBusinessHours() {
        return isWeekday() && now.getHour() >= 9 && now.getHour() < 17;
    }

    /**
     * Weekday traffic peaks, 10:00 to 14:00 and 18:00 to 21:00.
     */
    public boolean isPeakTraffic() {
        int hour = now.getHour();
        return isWeekday() && ((hour >= 10 && hour < 14) || (hour >= 18 && hour < 21));
    }

    /**
     * @return whether today falls between {@code start} and {@code end}, both inclusive
     */
    public boolean isWithin(LocalDate start, LocalDate end) {
        LocalDate today = now.toLocalDate();
        return !today.isBefore(start) && !today.isAfter(end);
    }
}
