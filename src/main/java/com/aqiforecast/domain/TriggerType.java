package com.aqiforecast.domain;

public enum TriggerType {
    PERFORMANCE,
    DRIFT,
    SCHEDULE,
    MANUAL
}
