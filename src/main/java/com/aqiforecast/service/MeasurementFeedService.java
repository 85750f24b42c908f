package com.aqiforecast.service;

import com.aqiforecast.domain.PredictionResult;
import com.aqiforecast.predictor.Predictor;
import com.aqiforecast.predictor.PredictorCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sole entry point of ground-truth measurements into the performance tracker and the drift
 * detector.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeasurementFeedService {

    private final PredictorCatalog catalog;
    private final PerformanceTracker performanceTracker;
    private final DriftDetector driftDetector;
    private final AtomicReference<Observation> lastObservation = new AtomicReference<>();

    public boolean onMeasurement(String predictorId, Map<String, Double> features, double actualValue, Instant timestamp) {
        return onMeasurement(predictorId, features, actualValue, timestamp, null);
    }

    /**
     * @param predicted the value the predictor forecast for these features; asked from the
     *                  predictor when null
     * @return whether the measurement reached the performance window
     */
    public boolean onMeasurement(String predictorId, Map<String, Double> features, double actualValue,
                                 Instant timestamp, Double predicted) {
        Predictor predictor = catalog.require(predictorId);
        driftDetector.ingest(predictorId, features);
        observe(actualValue, timestamp);

        double predictedValue;
        if (predicted != null) {
            predictedValue = predicted;
        } else {
            try {
                PredictionResult result = predictor.predict(features != null ? features : Map.of());
                predictedValue = result.value();
            } catch (RuntimeException ex) {
                log.warn("Measurement not scored | predictor={} | reason={}", predictorId, ex.getMessage());
                return false;
            }
        }
        performanceTracker.record(predictorId, predictedValue, actualValue, timestamp);
        return true;
    }

    /**
     * Feeds one measurement to every registered predictor.
     *
     * @return how many predictors scored it
     */
    public int onMeasurement(Map<String, Double> features, double actualValue, Instant timestamp) {
        int scored = 0;
        for (String id : catalog.ids()) {
            if (onMeasurement(id, features, actualValue, timestamp, null)) {
                scored++;
            }
        }
        log.debug("Measurement ingested | actual={} | timestamp={} | scored={}", actualValue, timestamp, scored);
        return scored;
    }

    public Optional<Double> lastActual() {
        return Optional.ofNullable(lastObservation.get()).map(Observation::value);
    }

    private void observe(double value, Instant timestamp) {
        if (!Double.isFinite(value) || timestamp == null) {
            return;
        }
        Observation candidate = new Observation(value, timestamp);
        lastObservation.accumulateAndGet(candidate,
            (current, next) -> current == null || !next.timestamp().isBefore(current.timestamp()) ? next : current);
    }

    private record Observation(double value, Instant timestamp) {}
}
