package com.aqiforecast.domain;

import java.util.Map;
import java.util.Optional;

/**
 * Outcome of an ensemble combination: either a combined prediction or a signal that no
 * predictor was usable and the caller must apply its rule-based fallback.
 */
public final class CombinationResult {

    private final EnsemblePrediction prediction;
    private final String fallbackReason;
    private final Map<String, Double> weightsConsulted;

    private CombinationResult(EnsemblePrediction prediction, String fallbackReason, Map<String, Double> weightsConsulted) {
        this.prediction = prediction;
        this.fallbackReason = fallbackReason;
        this.weightsConsulted = weightsConsulted;
    }

    public static CombinationResult combined(EnsemblePrediction prediction) {
        return new CombinationResult(prediction, null, prediction.getWeightsUsed());
    }

    public static CombinationResult fallbackRequired(String reason, Map<String, Double> weightsConsulted) {
        return new CombinationResult(null, reason, Map.copyOf(weightsConsulted));
    }

    public boolean isFallbackRequired() {
        return prediction == null;
    }

    public Optional<EnsemblePrediction> prediction() {
        return Optional.ofNullable(prediction);
    }

    public String fallbackReason() {
        return fallbackReason;
    }

    public Map<String, Double> weightsConsulted() {
        return weightsConsulted;
    }
}
