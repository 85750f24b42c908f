package com.aqiforecast.exception;

public class VersionNotFoundException extends AqiForecastException {
    public VersionNotFoundException(String predictorId) {
        super("VERSION_NOT_FOUND", "No validated version of model '" + predictorId + "' is on record.");
    }
}
