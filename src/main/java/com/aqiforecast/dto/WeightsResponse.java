package com.aqiforecast.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class WeightsResponse {
    Map<String, Double> weights;
    double sum;
}
