package com.aqiforecast.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class EnsemblePrediction {
    double value;
    double confidenceLower;
    double confidenceUpper;
    double combinedVariance;
    double confidenceLevel;
    /** Normalized weight times value per predictor; the contributions sum to {@code value}. */
    Map<String, Double> perModelContributions;
    Map<String, PredictionResult> predictions;
    Map<String, Double> weightsUsed;
    Instant timestamp;

    public double standardDeviation() {
        return Math.sqrt(combinedVariance);
    }
}
