package com.company.reliability.repository;

import com.company.reliability.domain.SliMeasurement;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Adapter over a metrics backend. The query string is passed through
 * untouched.
 *
 * @throws com.company.reliability.exception.ProviderQueryException on backend failure
 */
public interface SliTimeSeriesSource {

    List<SliMeasurement> getSliTimeSeries(String query, Instant start, Instant end, Duration step);
}
