package com.aqiforecast.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Assertion that retraining conditions were met for a predictor. Immutable: consumption
 * produces a copy with {@code consumedAt} set.
 */
@Value
@Builder(toBuilder = true)
public class RetrainingTrigger {
    UUID id;
    String predictorId;
    TriggerType type;
    Severity severity;
    String reason;
    Map<String, Object> details;
    Instant createdAt;
    Instant consumedAt;

    public static RetrainingTrigger create(String predictorId, TriggerType type, Severity severity,
                                           String reason, Map<String, Object> details, Instant now) {
        return RetrainingTrigger.builder()
            .id(UUID.randomUUID())
            .predictorId(predictorId)
            .type(type)
            .severity(severity)
            .reason(reason)
            .details(details == null ? Map.of() : Map.copyOf(details))
            .createdAt(now)
            .build();
    }

    public boolean isConsumed() {
        return consumedAt != null;
    }

    public RetrainingTrigger consumed(Instant at) {
        return toBuilder().consumedAt(at).build();
    }
}
