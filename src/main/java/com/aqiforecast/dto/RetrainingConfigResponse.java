package com.aqiforecast.dto;

import com.aqiforecast.domain.ScheduleEntry;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Read-only view of the thresholds and settings the retraining loop runs with.
 */
@Value
@Builder
public class RetrainingConfigResponse {
    double rmseDegradationThreshold;
    double accuracyDegradationThreshold;
    double meanShiftThreshold;
    double varianceRatioLower;
    double varianceRatioUpper;
    double maxRmse;
    double minAccuracy;
    boolean requireImprovement;
    int maxConcurrentRetrainings;
    long timeoutSeconds;
    String conflictPolicy;
    long triggerCheckIntervalMinutes;
    long scheduleCheckIntervalMinutes;
    int minIntervalDays;
    int maxIntervalDays;
    Map<String, ScheduleEntry> schedule;
}
