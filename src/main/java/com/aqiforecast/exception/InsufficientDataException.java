package com.aqiforecast.exception;

public class InsufficientDataException extends AqiForecastException {
    public InsufficientDataException(String predictorId, long available, long required) {
        super("INSUFFICIENT_DATA",
              "Predictor '" + predictorId + "' has " + available + " samples, at least " + required + " are required.");
    }
}
