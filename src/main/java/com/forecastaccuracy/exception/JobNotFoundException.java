package com.forecastaccuracy.exception;

import java.util.UUID;

public class JobNotFoundException extends ForecastAccuracyException {
    public JobNotFoundException(UUID jobId) {
        super("JOB_NOT_FOUND", "Job with id '" + jobId + "' not found.");
    }
}
