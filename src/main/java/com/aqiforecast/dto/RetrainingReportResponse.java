package com.aqiforecast.dto;

import com.aqiforecast.domain.RetrainingOutcome;
import com.aqiforecast.domain.RetrainingTrigger;
import com.aqiforecast.domain.ScheduleEntry;
import com.aqiforecast.domain.TriggerType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class RetrainingReportResponse {
    int totalRuns;
    int promoted;
    int rolledBack;
    int failed;
    double successRate;
    long meanDurationMs;
    Map<TriggerType, Long> triggerTypeCounts;
    List<RetrainingOutcome> recentOutcomes;
    Map<String, ScheduleEntry> schedule;
    Map<String, RetrainingTrigger> pendingTriggers;
}
