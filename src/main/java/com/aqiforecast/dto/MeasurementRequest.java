package com.aqiforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class MeasurementRequest {

    /** Feeds every predictor when absent. */
    String predictorId;

    Map<String, Double> features;

    @NotNull(message = "actualValue is required")
    Double actualValue;

    /** Defaults to the time of receipt. */
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;

    /** Only honoured together with predictorId. */
    Double predictedValue;
}
