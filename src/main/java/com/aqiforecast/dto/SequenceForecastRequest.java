package com.aqiforecast.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class SequenceForecastRequest {

    @NotEmpty(message = "features are required")
    Map<String, Double> features;

    @Min(value = 1, message = "hours must be >= 1")
    @Builder.Default
    Integer hours = 24;

    /** Per-hour feature values (weather forecast); entry 0 applies to hour 1. */
    List<Map<String, Double>> hourlyOverrides;
}
