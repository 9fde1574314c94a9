package com.company.reliability.domain;

import com.company.reliability.domain.enums.TimeWindowType;
import com.company.reliability.util.TimeUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeWindow {
    private String duration;

    @Builder.Default
    private TimeWindowType type = TimeWindowType.ROLLING;

    public static TimeWindow rolling(String duration) {
        return new TimeWindow(duration, TimeWindowType.ROLLING);
    }

    public static TimeWindow calendar(String duration) {
        return new TimeWindow(duration, TimeWindowType.CALENDAR);
    }

    public Duration toDuration() {
        return TimeUtils.parseDuration(duration);
    }

    public Instant getStartTime(Instant end) {
        Duration length = toDuration();
        if (type == TimeWindowType.CALENDAR) {
            return TimeUtils.alignCalendarStart(end, length);
        }
        return end.minus(length);
    }
}
