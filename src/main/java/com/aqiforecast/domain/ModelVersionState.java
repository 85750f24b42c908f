package com.aqiforecast.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a model version record. A predictor without any record is implicitly idle.
 */
public enum ModelVersionState {
    TRIGGERED,
    RUNNING,
    VALIDATING,
    PROMOTED,
    ROLLED_BACK,
    FAILED,
    ARCHIVED;

    public Set<ModelVersionState> allowedTargets() {
        return switch (this) {
            case TRIGGERED -> EnumSet.of(RUNNING, FAILED);
            case RUNNING -> EnumSet.of(VALIDATING, FAILED);
            case VALIDATING -> EnumSet.of(PROMOTED, ROLLED_BACK, FAILED);
            case PROMOTED -> EnumSet.of(ARCHIVED);
            case ROLLED_BACK, FAILED, ARCHIVED -> EnumSet.noneOf(ModelVersionState.class);
        };
    }

    public boolean canTransitionTo(ModelVersionState target) {
        return allowedTargets().contains(target);
    }

    public boolean isInFlight() {
        return this == TRIGGERED || this == RUNNING || this == VALIDATING;
    }
}
