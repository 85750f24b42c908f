package com.aqiforecast.exception;

public class UnknownModelException extends AqiForecastException {
    public UnknownModelException(String predictorId) {
        super("UNKNOWN_MODEL", "Model with id '" + predictorId + "' not found.");
    }
}
