package com.aqiforecast.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * A retraining is already in flight for the predictor. When the conflict policy queues
 * triggers, {@link #getQueuedTriggerId()} names the trigger left pending for the next run.
 */
@Getter
public class ConcurrencyConflictException extends AqiForecastException {
    private final String predictorId;
    private final UUID queuedTriggerId;

    public ConcurrencyConflictException(String predictorId, UUID queuedTriggerId) {
        super("RETRAINING_CONFLICT",
              "A retraining is already running for predictor '" + predictorId + "'"
                  + (queuedTriggerId != null ? "; trigger " + queuedTriggerId + " queued." : "; request rejected."));
        this.predictorId = predictorId;
        this.queuedTriggerId = queuedTriggerId;
    }
}
