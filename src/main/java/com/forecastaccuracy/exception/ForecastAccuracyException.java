package com.forecastaccuracy.exception;

import lombok.Getter;

@Getter
public abstract class ForecastAccuracyException extends RuntimeException {
    private final String errorCode;
    protected ForecastAccuracyException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected ForecastAccuracyException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
