package com.company.reliability.util;

import com.company.reliability.exception.ValidationException;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class TimeUtils {

    private static final Pattern DURATION_PATTERN = Pattern.compile("^(\\d+)([mhdw])$");

    private TimeUtils() {
    }

    /**
     * Parse a window duration such as {@code 30d}, {@code 12h}, {@code 4w}
     * or {@code 90m}.
     *
     * @throws ValidationException when the unit or amount is not recognised
     */
    public static Duration parseDuration(String duration) {
        if (duration == null || duration.isBlank()) {
            throw new ValidationException("Duration must not be empty");
        }
        Matcher matcher = DURATION_PATTERN.matcher(duration.trim().toLowerCase());
        if (!matcher.matches()) {
            throw new ValidationException("Invalid duration format: " + duration);
        }
        long amount = Long.parseLong(matcher.group(1));
        switch (matcher.group(2)) {
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "d":
                return Duration.ofDays(amount);
            case "w":
                return Duration.ofDays(amount * 7);
            default:
                throw new ValidationException("Invalid duration unit: " + duration);
        }
    }

    public static double minutesBetween(Instant start, Instant end) {
        if (start == null || end == null) {
            return 0.0;
        }
        return Duration.between(start, end).toMillis() / 60_000.0;
    }

    public static double toMinutes(Duration duration) {
        return duration.toMillis() / 60_000.0;
    }

    /**
     * Start of a calendar-aligned window ending at {@code end}, in UTC.
     * A one-week duration starts on the Monday of the current ISO week, month
     * sized durations on the first of the month, anything else at midnight.
     */
    public static Instant alignCalendarStart(Instant end, Duration duration) {
        ZonedDateTime endUtc = end.atZone(ZoneOffset.UTC);
        long days = duration.toDays();

        if (days == 7 && duration.toHoursPart() == 0) {
            LocalDate monday = endUtc.toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            return monday.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (days >= 28) {
            return endUtc.toLocalDate().withDayOfMonth(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return end.minus(duration).atZone(ZoneOffset.UTC).toLocalDate()
                .atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static String formatMinutes(double minutes) {
        if (Double.isNaN(minutes)) {
            return "n/a";
        }
        long total = Math.round(minutes);
        long hours = total / 60;
        long remainder = total % 60;

        if (hours > 0) {
            return String.format("%dh %dm", hours, remainder);
        }
        return String.format("%dm", remainder);
    }
}
