package com.aqiforecast.service;

import com.aqiforecast.config.ForecastProperties;
import com.aqiforecast.domain.CombinationResult;
import com.aqiforecast.domain.EnsemblePrediction;
import com.aqiforecast.domain.PredictionResult;
import com.aqiforecast.domain.WeightVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Weighted combination of independent predictions into one estimate with a confidence band.
 * Stateless; safe to call from any number of request threads.
 */
@Slf4j
@Component
public class EnsembleCombiner {

    private final boolean clampLowerBoundAtZero;
    private final double defaultConfidenceLevel;

    public EnsembleCombiner(ForecastProperties properties) {
        this.clampLowerBoundAtZero = properties.getEnsemble().isClampLowerBoundAtZero();
        this.defaultConfidenceLevel = properties.getEnsemble().getConfidenceLevel();
    }

    /**
     * Combines at the configured {@code forecast.ensemble.confidence-level}.
     */
    public CombinationResult combine(Map<String, PredictionResult> predictions, WeightVector weights) {
        return combine(predictions, weights, defaultConfidenceLevel);
    }

    public CombinationResult combine(Map<String, PredictionResult> predictions, WeightVector weights,
                                     double confidenceLevel) {
        double z = StandardNormal.twoSidedQuantile(confidenceLevel);

        // sorted iteration keeps the floating point sums identical across calls
        Map<String, PredictionResult> usable = new TreeMap<>();
        double totalWeight = 0.0d;
        for (Map.Entry<String, PredictionResult> entry : new TreeMap<>(predictions).entrySet()) {
            double w = weights.weightOf(entry.getKey());
            if (entry.getValue() == null || w <= 0.0d) {
                log.debug("Predictor dropped from ensemble | predictor={} | weight={}", entry.getKey(), w);
                continue;
            }
            usable.put(entry.getKey(), entry.getValue());
            totalWeight += w;
        }

        if (usable.isEmpty()) {
            return CombinationResult.fallbackRequired(
                "No predictor with a positive weight produced a prediction", weights.asMap());
        }

        Map<String, Double> normalized = new LinkedHashMap<>();
        double mean = 0.0d;
        Instant latest = Instant.EPOCH;
        for (Map.Entry<String, PredictionResult> entry : usable.entrySet()) {
            double w = weights.weightOf(entry.getKey()) / totalWeight;
            normalized.put(entry.getKey(), w);
            mean += w * entry.getValue().value();
            if (entry.getValue().timestamp().isAfter(latest)) {
                latest = entry.getValue().timestamp();
            }
        }

        double variance = 0.0d;
        Map<String, Double> contributions = new LinkedHashMap<>();
        for (Map.Entry<String, PredictionResult> entry : usable.entrySet()) {
            double w = normalized.get(entry.getKey());
            PredictionResult p = entry.getValue();
            double deviation = p.value() - mean;
            variance += w * w * (p.uncertainty() * p.uncertainty() + deviation * deviation);
            contributions.put(entry.getKey(), w * p.value());
        }

        double halfWidth = z * Math.sqrt(variance);
        double lower = mean - halfWidth;
        if (clampLowerBoundAtZero && mean >= 0.0d) {
            lower = Math.max(0.0d, lower);
        }

        return CombinationResult.combined(EnsemblePrediction.builder()
            .value(mean)
            .confidenceLower(lower)
            .confidenceUpper(mean + halfWidth)
            .combinedVariance(variance)
            .confidenceLevel(confidenceLevel)
            .perModelContributions(Collections.unmodifiableMap(contributions))
            .predictions(Collections.unmodifiableMap(new LinkedHashMap<>(usable)))
            .weightsUsed(Collections.unmodifiableMap(normalized))
            .timestamp(latest)
            .build());
    }
}
