package com.aqiforecast.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Adaptive retraining cadence of one predictor. {@code performanceWeight} is the interval
 * multiplier applied by the most recent retraining outcome.
 */
public record ScheduleEntry(String predictorId, int intervalDays, Instant lastRunAt, double performanceWeight) {

    public boolean isDue(Instant now) {
        return lastRunAt == null || !now.isBefore(lastRunAt.plus(Duration.ofDays(intervalDays)));
    }

    public ScheduleEntry withRun(Instant runAt) {
        return new ScheduleEntry(predictorId, intervalDays, runAt, performanceWeight);
    }

    public ScheduleEntry withInterval(int newIntervalDays, double multiplier, Instant runAt) {
        return new ScheduleEntry(predictorId, newIntervalDays, runAt, multiplier);
    }
}
