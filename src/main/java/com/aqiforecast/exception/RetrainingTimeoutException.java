package com.aqiforecast.exception;

import java.time.Duration;

public class RetrainingTimeoutException extends AqiForecastException {
    public RetrainingTimeoutException(String predictorId, Duration timeout) {
        super("RETRAINING_TIMEOUT",
              "Retraining of predictor '" + predictorId + "' exceeded its budget of " + timeout.toMinutes() + " minutes.");
    }
}
