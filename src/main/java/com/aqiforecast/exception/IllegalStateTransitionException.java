package com.aqiforecast.exception;

import com.aqiforecast.domain.ModelVersionState;

public class IllegalStateTransitionException extends AqiForecastException {
    public IllegalStateTransitionException(String predictorId, ModelVersionState from, ModelVersionState to) {
        super("ILLEGAL_STATE_TRANSITION",
              "Predictor '" + predictorId + "' cannot move from " + from + " to " + to + ".");
    }
}
