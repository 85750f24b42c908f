package com.aqiforecast.service;

import com.aqiforecast.config.ForecastProperties;
import com.aqiforecast.domain.CombinationResult;
import com.aqiforecast.domain.EnsembleForecast;
import com.aqiforecast.domain.EnsemblePrediction;
import com.aqiforecast.domain.PredictionResult;
import com.aqiforecast.domain.WeightVector;
import com.aqiforecast.exception.InvalidForecastRequestException;
import com.aqiforecast.predictor.Predictor;
import com.aqiforecast.predictor.PredictorCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans a feature vector out to every predictor in parallel and combines whatever answers in
 * time with the current weight snapshot.
 */
@Slf4j
@Service
public class EnsembleForecastService {

    private final PredictorCatalog catalog;
    private final EnsembleCombiner combiner;
    private final WeightStore weightStore;
    private final MeasurementFeedService measurementFeed;
    private final ForecastProperties.Ensemble ensembleConfig;
    private final ForecastProperties.Fallback fallbackConfig;
    private final Clock clock;

    public EnsembleForecastService(PredictorCatalog catalog, EnsembleCombiner combiner, WeightStore weightStore,
                                   MeasurementFeedService measurementFeed, ForecastProperties properties, Clock clock) {
        this.catalog = catalog;
        this.combiner = combiner;
        this.weightStore = weightStore;
        this.measurementFeed = measurementFeed;
        this.ensembleConfig = properties.getEnsemble();
        this.fallbackConfig = properties.getFallback();
        this.clock = clock;
    }

    public Mono<EnsembleForecast> forecast(Map<String, Double> features) {
        return forecast(features, ensembleConfig.getConfidenceLevel());
    }

    public Mono<EnsembleForecast> forecast(Map<String, Double> features, double confidenceLevel) {
        WeightVector weights = weightStore.current();
        Map<String, String> unavailable = new ConcurrentHashMap<>();
        Duration timeout = ensembleConfig.getPredictTimeout();

        return Flux.fromIterable(catalog.all())
            .flatMap(predictor -> predict(predictor, features, timeout)
                .map(result -> Map.entry(predictor.id(), result))
                .onErrorResume(ex -> {
                    log.warn("Predictor skipped for forecast | predictor={} | reason={}", predictor.id(), ex.toString());
                    unavailable.put(predictor.id(), ex.getClass().getSimpleName());
                    return Mono.empty();
                }))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .map(predictions -> toForecast(combiner.combine(predictions, weights, confidenceLevel), unavailable));
    }

    /**
     * Hourly multi-step forecast. Step {@code h} sees the request features with the overrides of
     * hours 1..h applied, {@code hour} and {@code day_of_week} moved to the target hour when the
     * request carries them, and the previous step's value in the lag feature. A step that fails
     * outright is served by the fallback rule.
     *
     * @param hourlyOverrides feature values per hour (weather forecast), index 0 for hour 1; may be shorter
     *                        than the horizon or null
     */
    public Mono<List<EnsembleForecast>> forecastSequence(Map<String, Double> features, int hours,
                                                        List<Map<String, Double>> hourlyOverrides) {
        if (hours < 1 || hours > ensembleConfig.getMaxHorizonHours()) {
            throw new InvalidForecastRequestException(
                "hours must be between 1 and " + ensembleConfig.getMaxHorizonHours() + ", got " + hours);
        }
        Instant origin = clock.instant();
        String lagFeature = ensembleConfig.getLagFeature();
        Map<String, Double> current = new HashMap<>(features);

        return Flux.range(1, hours)
            .concatMap(h -> {
                Instant target = origin.plus(Duration.ofHours(h));
                Map<String, Double> step = nextStep(current, h, target, hourlyOverrides);
                return forecast(step)
                    .onErrorResume(ex -> {
                        log.error("Sequence step failed | hour={} | reason={}", h, ex.toString());
                        return Mono.just(fallback("Sequence step failed: " + ex.getMessage(), Map.of()));
                    })
                    .map(f -> {
                        if (lagFeature != null && current.containsKey(lagFeature)) {
                            current.put(lagFeature, f.getPrediction().getValue());
                        }
                        return f.toBuilder().horizonHours(h).targetTime(target).build();
                    });
            })
            .collectList()
            .doOnNext(steps -> log.info("Sequence forecast | hours={} | fallbackSteps={}",
                hours, steps.stream().filter(EnsembleForecast::isFallback).count()));
    }

    private static Map<String, Double> nextStep(Map<String, Double> current, int hour, Instant target,
                                                List<Map<String, Double>> hourlyOverrides) {
        if (hourlyOverrides != null && hour <= hourlyOverrides.size() && hourlyOverrides.get(hour - 1) != null) {
            current.putAll(hourlyOverrides.get(hour - 1));
        }
        ZonedDateTime at = target.atZone(ZoneOffset.UTC);
        if (current.containsKey("hour")) {
            current.put("hour", (double) at.getHour());
        }
        if (current.containsKey("day_of_week")) {
            current.put("day_of_week", (double) (at.getDayOfWeek().getValue() - 1));
        }
        return Collections.unmodifiableMap(new HashMap<>(current));
    }

    private Mono<PredictionResult> predict(Predictor predictor, Map<String, Double> features, Duration timeout) {
        return Mono.fromCallable(() -> predictor.predict(features))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout);
    }

    private EnsembleForecast toForecast(CombinationResult result, Map<String, String> unavailable) {
        Map<String, String> failures = new TreeMap<>(unavailable);
        if (result.prediction().isPresent()) {
            EnsemblePrediction prediction = result.prediction().get();
            log.debug("Ensemble forecast | value={} | lower={} | upper={} | predictors={}",
                prediction.getValue(), prediction.getConfidenceLower(), prediction.getConfidenceUpper(),
                prediction.getWeightsUsed().keySet());
            return EnsembleForecast.builder()
                .prediction(prediction)
                .fallback(false)
                .unavailable(failures)
                .build();
        }

        return fallback(result.fallbackReason(), failures);
    }

    private EnsembleForecast fallback(String reason, Map<String, String> failures) {
        double value = measurementFeed.lastActual().orElse(fallbackConfig.getDefaultValue());
        double halfWidth = Math.abs(value) * fallbackConfig.getBandFraction();
        double lower = value - halfWidth;
        if (ensembleConfig.isClampLowerBoundAtZero() && value >= 0.0d) {
            lower = Math.max(0.0d, lower);
        }
        log.warn("Fallback forecast served | value={} | reason={} | unavailable={}", value, reason, failures);
        return EnsembleForecast.builder()
            .prediction(EnsemblePrediction.builder()
                .value(value)
                .confidenceLower(lower)
                .confidenceUpper(value + halfWidth)
                .combinedVariance(0.0d)
                .confidenceLevel(ensembleConfig.getConfidenceLevel())
                .perModelContributions(Map.of())
                .predictions(Map.of())
                .weightsUsed(Map.of())
                .timestamp(clock.instant())
                .build())
            .fallback(true)
            .fallbackReason(reason)
            .unavailable(failures)
            .build();
    }
}
