package com.aqiforecast.domain;

import java.time.Instant;
import java.util.Objects;

public record PredictionResult(double value, double uncertainty, Instant timestamp) {
    public PredictionResult {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Prediction value must be finite");
        }
        if (Double.isNaN(uncertainty) || uncertainty < 0.0d) {
            throw new IllegalArgumentException("Prediction uncertainty must be >= 0");
        }
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
