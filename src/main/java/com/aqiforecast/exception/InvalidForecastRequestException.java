package com.aqiforecast.exception;

public class InvalidForecastRequestException extends AqiForecastException {
    public InvalidForecastRequestException(String message) {
        super("INVALID_FORECAST_REQUEST", message);
    }
}
