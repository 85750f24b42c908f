package com.aqiforecast.domain;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Summary of the most recent retraining outcomes, newest last.
 */
public record RetrainingReport(
    int totalRuns,
    int promoted,
    int rolledBack,
    int failed,
    double successRate,
    Duration meanDuration,
    Map<TriggerType, Long> triggerTypeCounts,
    List<RetrainingOutcome> recentOutcomes
) {}
