package com.aqiforecast.domain;

public record FeatureDrift(
    String feature,
    double baselineMean,
    double baselineStd,
    double recentMean,
    double recentStd,
    double meanShift,
    double varianceRatio,
    boolean driftDetected
) {}
