package com.forecastaccuracy.exception;

import java.util.UUID;

public class RunNotReadyException extends ForecastAccuracyException {
    public RunNotReadyException(UUID runId, String status) {
        super("RUN_NOT_READY", "Run '" + runId + "' is " + status + "; its series is not available yet.");
    }
}
