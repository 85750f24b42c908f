package com.aqiforecast.dto;

import com.aqiforecast.domain.PerformanceRecord;
import com.aqiforecast.domain.RetrainingTrigger;
import com.aqiforecast.domain.ScheduleEntry;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ModelStatusResponse {
    String predictorId;
    /** State of the in-flight retraining record, or IDLE. */
    String lifecycleState;
    String activeVersion;
    double currentWeight;
    /** Null while the performance window holds too few samples. */
    PerformanceRecord latestPerformance;
    RetrainingTrigger pendingTrigger;
    ScheduleEntry schedule;
    List<RetrainingTrigger> recentTriggers;
}
