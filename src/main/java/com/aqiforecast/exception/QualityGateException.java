package com.aqiforecast.exception;

public class QualityGateException extends AqiForecastException {
    public QualityGateException(String message) {
        super("QUALITY_GATE_FAILED", message);
    }
}
