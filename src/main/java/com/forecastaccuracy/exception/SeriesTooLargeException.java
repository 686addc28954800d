package com.forecastaccuracy.exception;

public class SeriesTooLargeException extends ForecastAccuracyException {
    public SeriesTooLargeException(String series, int size, int max) {
        super("SERIES_TOO_LARGE",
              "Series '" + series + "' has " + size + " points, exceeding the maximum of " + max + ".");
    }
}
