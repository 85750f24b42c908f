package com.aqiforecast.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class ModelVersionRecord {
    UUID recordId;
    String predictorId;
    /** Assigned by the predictor once training completes. */
    String version;
    ModelVersionState state;
    ValidationMetrics metrics;
    Instant createdAt;
    Instant updatedAt;
    Instant promotedAt;
    UUID triggerId;
    String failureReason;
}
