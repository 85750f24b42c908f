package com.aqiforecast.domain;

import java.time.Instant;
import java.util.List;

/**
 * Result of an on-demand evaluation of every retraining condition.
 */
public record TriggerCheck(List<RetrainingTrigger> created, int runsStarted, Instant checkedAt) {
    public TriggerCheck {
        created = List.copyOf(created);
    }
}
