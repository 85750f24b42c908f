package com.aqiforecast.domain;

import java.util.List;

/**
 * Baseline versus recent feature distribution of one predictor's inputs. The scalar statistics
 * describe {@code dominantFeature}, the feature with the largest mean shift.
 */
public record DriftSummary(
    String predictorId,
    double baselineMean,
    double baselineStd,
    double recentMean,
    double recentStd,
    long baselineSampleCount,
    long recentSampleCount,
    double meanShift,
    double varianceRatio,
    boolean driftDetected,
    String dominantFeature,
    List<FeatureDrift> features
) {
    public DriftSummary {
        features = features == null ? List.of() : List.copyOf(features);
    }

    public long sampleCount() {
        return baselineSampleCount + recentSampleCount;
    }
}
