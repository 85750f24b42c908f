package com.aqiforecast.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MeasurementResponse {
    int predictorsScored;
    String requestId;
}
