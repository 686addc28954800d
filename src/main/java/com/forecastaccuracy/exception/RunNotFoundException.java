package com.forecastaccuracy.exception;

import java.util.UUID;

public class RunNotFoundException extends ForecastAccuracyException {
    public RunNotFoundException(UUID runId) {
        super("RUN_NOT_FOUND", "Run with id '" + runId + "' not found.");
    }
}
