package com.aqiforecast.exception;

public class ConfigurationValidationException extends AqiForecastException {
    public ConfigurationValidationException(String message) {
        super("INVALID_CONFIGURATION", message);
    }
}
