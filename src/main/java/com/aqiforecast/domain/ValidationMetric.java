package com.aqiforecast.domain;

public enum ValidationMetric {
    RMSE(true),
    MAE(true),
    ACCURACY_WITHIN_THRESHOLD(false);

    private final boolean lowerIsBetter;

    ValidationMetric(boolean lowerIsBetter) {
        this.lowerIsBetter = lowerIsBetter;
    }

    public boolean lowerIsBetter() {
        return lowerIsBetter;
    }

    public double valueOf(ValidationMetrics metrics) {
        return switch (this) {
            case RMSE -> metrics.rmse();
            case MAE -> metrics.mae();
            case ACCURACY_WITHIN_THRESHOLD -> metrics.accuracyWithinThreshold();
        };
    }
}
