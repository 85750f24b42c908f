package com.aqiforecast.exception;

import lombok.Getter;

@Getter
public abstract class AqiForecastException extends RuntimeException {
    private final String errorCode;
    protected AqiForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected AqiForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
