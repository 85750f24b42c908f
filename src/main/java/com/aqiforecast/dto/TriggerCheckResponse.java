package com.aqiforecast.dto;

import com.aqiforecast.domain.RetrainingTrigger;
import com.aqiforecast.domain.TriggerCheck;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class TriggerCheckResponse {
    List<RetrainingTrigger> triggersCreated;
    int runsStarted;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant checkedAt;

    public static TriggerCheckResponse from(TriggerCheck check) {
        return TriggerCheckResponse.builder()
            .triggersCreated(check.created())
            .runsStarted(check.runsStarted())
            .checkedAt(check.checkedAt())
            .build();
    }
}
