package com.forecastaccuracy.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Error record for a day on which both an actual and a forecast exist.
 * {@code ape} is null when |actual| is below the denominator floor.
 */
@Value
@Builder
public class DailyError {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    double actual;
    double forecast;
    double error;
    double absError;
    Double ape;

    public static DailyError of(LocalDate date, double actual, double forecast, double floor) {
        double error = forecast - actual;
        double absError = Math.abs(error);
        Double ape = Math.abs(actual) >= floor ? absError / Math.abs(actual) : null;
        return DailyError.builder()
            .date(date)
            .actual(actual)
            .forecast(forecast)
            .error(error)
            .absError(absError)
            .ape(ape)
            .build();
    }
}
