package com.forecastaccuracy.exception;

public class ForecasterUnavailableException extends ForecastAccuracyException {
    public ForecasterUnavailableException(Throwable cause) {
        super("FORECASTER_UNAVAILABLE",
              "The upstream forecasting service is currently unavailable. Please try again later.",
              cause);
    }
}
