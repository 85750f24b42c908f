package com.aqiforecast.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class ForecastRequest {

    @NotEmpty(message = "features are required")
    Map<String, Double> features;

    @DecimalMin(value = "0.5", message = "confidenceLevel must be >= 0.5")
    @DecimalMax(value = "0.999", message = "confidenceLevel must be < 1")
    Double confidenceLevel;
}
