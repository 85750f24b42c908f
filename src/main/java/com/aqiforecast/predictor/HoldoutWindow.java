package com.aqiforecast.predictor;

import java.time.Instant;

public record HoldoutWindow(Instant from, Instant to) {}
