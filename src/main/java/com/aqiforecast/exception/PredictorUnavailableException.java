package com.aqiforecast.exception;

public class PredictorUnavailableException extends AqiForecastException {
    public PredictorUnavailableException(String predictorId, Throwable cause) {
        super("PREDICTOR_UNAVAILABLE",
              "Predictor '" + predictorId + "' is currently unavailable. Please try again later.",
              cause);
    }
}
