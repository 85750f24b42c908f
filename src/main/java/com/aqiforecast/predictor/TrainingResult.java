package com.aqiforecast.predictor;

import java.util.Map;

public record TrainingResult(String version, Map<String, Double> metrics) {
    public TrainingResult {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Training must produce a version");
        }
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }
}
