package com.company.reliability.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One SLI sample. {@code value} may be NaN when the source had no data.
 * {@code durationSeconds} is optional; when absent the gap to the next
 * sample is used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SliMeasurement {
    private Instant timestamp;
    private double value;
    private Double durationSeconds;

    public static SliMeasurement of(Instant timestamp, double value) {
        return new SliMeasurement(timestamp, value, null);
    }
}
