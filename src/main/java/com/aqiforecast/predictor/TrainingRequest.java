package com.aqiforecast.predictor;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

public record TrainingRequest(
    String predictorId,
    UUID triggerId,
    Instant dataFrom,
    Instant dataTo,
    AtomicBoolean cancellation
) {
    public boolean isCancelled() {
        return cancellation.get() || Thread.currentThread().isInterrupted();
    }

    public void cancel() {
        cancellation.set(true);
    }
}
