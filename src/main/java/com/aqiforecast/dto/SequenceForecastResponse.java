package com.aqiforecast.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SequenceForecastResponse {
    int hours;
    long fallbackSteps;
    List<ForecastResponse> steps;
    String requestId;
}
