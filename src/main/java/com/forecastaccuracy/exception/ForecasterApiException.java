package com.forecastaccuracy.exception;

public class ForecasterApiException extends ForecastAccuracyException {
    public ForecasterApiException(String message) {
        super("FORECASTER_API_ERROR", message);
    }
    public ForecasterApiException(String message, Throwable cause) {
        super("FORECASTER_API_ERROR", message, cause);
    }
}
