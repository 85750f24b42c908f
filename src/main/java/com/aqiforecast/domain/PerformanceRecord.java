package com.aqiforecast.domain;

import java.time.Instant;

public record PerformanceRecord(
    String predictorId,
    Instant windowStart,
    Instant windowEnd,
    double rmse,
    double mae,
    double accuracyWithinThreshold,
    long sampleCount
) {}
