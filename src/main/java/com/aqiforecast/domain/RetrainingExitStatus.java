package com.aqiforecast.domain;

/**
 * Process exit codes of a command-line retraining request.
 */
public enum RetrainingExitStatus {
    SUCCESS(0),
    VALIDATION_FAILED(1),
    UNKNOWN_MODEL(2),
    CONFLICT(3);

    private final int code;

    RetrainingExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
