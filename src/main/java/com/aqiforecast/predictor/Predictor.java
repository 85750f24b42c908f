package com.aqiforecast.predictor;

import com.aqiforecast.domain.PredictionResult;
import com.aqiforecast.domain.ValidationMetrics;

import java.util.Map;

/**
 * A trainable forecasting model. The lifecycle core only talks to models through this
 * interface and never inspects their internals.
 */
public interface Predictor {

    String id();

    PredictionResult predict(Map<String, Double> features);

    /**
     * Trains a new candidate version. Long running; implementations should poll
     * {@link TrainingRequest#isCancelled()} and honour thread interruption.
     */
    TrainingResult train(TrainingRequest request);

    ValidationMetrics validate(String version, HoldoutWindow holdout);
}
