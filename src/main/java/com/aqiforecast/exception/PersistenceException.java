package com.aqiforecast.exception;

public class PersistenceException extends AqiForecastException {
    public PersistenceException(String operation, int attempts, Throwable cause) {
        super("PERSISTENCE_UNAVAILABLE",
              "Model store operation '" + operation + "' failed after " + attempts + " attempts.",
              cause);
    }
}
