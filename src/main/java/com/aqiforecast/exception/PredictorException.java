package com.aqiforecast.exception;

public class PredictorException extends AqiForecastException {
    public PredictorException(String message) {
        super("PREDICTOR_ERROR", message);
    }
    public PredictorException(String message, Throwable cause) {
        super("PREDICTOR_ERROR", message, cause);
    }
}
