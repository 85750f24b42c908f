package com.aqiforecast.domain;

/**
 * Trigger severity, declared from lowest to highest.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isHigherThan(Severity other) {
        return other == null || compareTo(other) > 0;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
