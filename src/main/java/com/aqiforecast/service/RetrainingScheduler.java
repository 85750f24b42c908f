package com.aqiforecast.service;

import com.aqiforecast.config.ForecastProperties;
import com.aqiforecast.domain.RetrainingTrigger;
import com.aqiforecast.domain.ScheduleEntry;
import com.aqiforecast.domain.ValidationMetrics;
import com.aqiforecast.predictor.PredictorCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Time-based retraining cadence. Each predictor has its own interval, shortened after poor
 * validation scores and extended after good ones.
 */
@Slf4j
@Service
public class RetrainingScheduler {

    private static final double NEUTRAL_WEIGHT = 1.0d;

    private final RetrainingTriggerEngine triggerEngine;
    private final ForecastProperties.Schedule config;
    private final Clock clock;
    private final ConcurrentHashMap<String, ScheduleEntry> entries = new ConcurrentHashMap<>();

    public RetrainingScheduler(RetrainingTriggerEngine triggerEngine, PredictorCatalog catalog,
                               ForecastProperties properties, Clock clock) {
        this.triggerEngine = triggerEngine;
        this.config = properties.getSchedule();
        this.clock = clock;

        Map<String, Integer> configured = new TreeMap<>();
        for (ForecastProperties.PredictorEndpoint endpoint : properties.getPredictors()) {
            if (endpoint.getInitialIntervalDays() != null) {
                configured.put(endpoint.getId(), endpoint.getInitialIntervalDays());
            }
        }
        for (String id : catalog.ids()) {
            int interval = configured.getOrDefault(id, config.getDefaultIntervalDays());
            entries.put(id, new ScheduleEntry(id, clampInterval(interval), null, NEUTRAL_WEIGHT));
        }
    }

    /**
     * Fires a schedule evaluation for every predictor whose interval has elapsed.
     */
    public List<RetrainingTrigger> tick() {
        Instant now = clock.instant();
        List<RetrainingTrigger> created = new ArrayList<>();
        for (ScheduleEntry entry : entries().values()) {
            if (entry.isDue(now)) {
                triggerEngine.evaluateSchedule(entry).ifPresent(created::add);
            }
        }
        if (!created.isEmpty()) {
            log.info("Schedule tick | triggers={}", created.size());
        }
        return created;
    }

    /**
     * Adjusts the interval of a predictor from the validation score of its latest run.
     */
    public ScheduleEntry recordOutcome(String predictorId, double validationScore, Instant runAt) {
        ScheduleEntry updated = entries.compute(predictorId, (id, current) -> {
            ScheduleEntry entry = current != null ? current
                : new ScheduleEntry(id, config.getDefaultIntervalDays(), null, NEUTRAL_WEIGHT);
            if (validationScore < config.getLowScoreThreshold()) {
                int shortened = Math.max(config.getMinIntervalDays(),
                    (int) Math.round(entry.intervalDays() * config.getShortenFactor()));
                return entry.withInterval(shortened, config.getShortenFactor(), runAt);
            }
            if (validationScore > config.getHighScoreThreshold()) {
                int extended = Math.min(config.getMaxIntervalDays(),
                    (int) Math.round(entry.intervalDays() * config.getExtendFactor()));
                return entry.withInterval(extended, config.getExtendFactor(), runAt);
            }
            return entry.withInterval(entry.intervalDays(), NEUTRAL_WEIGHT, runAt);
        });
        log.info("Retraining interval updated | predictor={} | score={} | intervalDays={} | weight={}",
            predictorId, String.format("%.3f", validationScore), updated.intervalDays(), updated.performanceWeight());
        return updated;
    }

    /**
     * Records a run that produced no validation score; only the run time moves.
     */
    public ScheduleEntry recordRun(String predictorId, Instant runAt) {
        return entries.compute(predictorId, (id, current) -> current != null
            ? current.withRun(runAt)
            : new ScheduleEntry(id, config.getDefaultIntervalDays(), runAt, NEUTRAL_WEIGHT));
    }

    /**
     * Mean of an RMSE score, 1 at or below the best RMSE and 0 a full span above it, and the
     * accuracy-within-threshold fraction.
     */
    public double validationScore(ValidationMetrics metrics) {
        double rmseScore = 1.0d - (metrics.rmse() - config.getScoreBestRmse()) / config.getScoreRmseSpan();
        rmseScore = Math.max(0.0d, Math.min(1.0d, rmseScore));
        double accuracy = Math.max(0.0d, Math.min(1.0d, metrics.accuracyWithinThreshold()));
        return (rmseScore + accuracy) / 2.0d;
    }

    public Optional<ScheduleEntry> entry(String predictorId) {
        return Optional.ofNullable(entries.get(predictorId));
    }

    public Map<String, ScheduleEntry> entries() {
        return new TreeMap<>(entries);
    }

    private int clampInterval(int days) {
        return Math.max(config.getMinIntervalDays(), Math.min(config.getMaxIntervalDays(), days));
    }
}
