package com.aqiforecast.store;

import com.aqiforecast.domain.ValidationMetrics;

import java.time.Instant;

public record StoredModelVersion(
    String name,
    String version,
    String stage,
    String runId,
    ValidationMetrics metrics,
    Instant createdAt,
    Instant updatedAt
) {
    public boolean inStage(String expected) {
        return expected != null && expected.equalsIgnoreCase(stage);
    }
}
