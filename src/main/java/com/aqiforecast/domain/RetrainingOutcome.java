package com.aqiforecast.domain;

import java.time.Duration;
import java.util.UUID;

public record RetrainingOutcome(
    String predictorId,
    UUID recordId,
    UUID triggerId,
    TriggerType triggerType,
    Severity severity,
    ModelVersionState finalState,
    String version,
    ValidationMetrics metrics,
    Duration duration,
    String failureReason
) {
    public boolean promoted() {
        return finalState == ModelVersionState.PROMOTED;
    }

    public RetrainingExitStatus exitStatus() {
        return promoted() ? RetrainingExitStatus.SUCCESS : RetrainingExitStatus.VALIDATION_FAILED;
    }
}
