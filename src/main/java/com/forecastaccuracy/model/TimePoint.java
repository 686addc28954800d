package com.forecastaccuracy.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One calendar day of a series. Actual and forecast series are separate inputs,
 * so a point usually carries either {@code actual} or {@code forecast} (with its band).
 * Absent values are {@code null}, never zero.
 */
@Value
@Builder(toBuilder = true)
public class TimePoint {
    LocalDate date;
    Double actual;
    Double forecast;
    Double p05;
    Double p95;

    public static TimePoint actual(LocalDate date, Double value) {
        return TimePoint.builder().date(date).actual(finiteOrNull(value)).build();
    }

    public static TimePoint forecast(LocalDate date, Double forecast, Double p05, Double p95) {
        return TimePoint.builder()
            .date(date)
            .forecast(finiteOrNull(forecast))
            .p05(finiteOrNull(p05))
            .p95(finiteOrNull(p95))
            .build();
    }

    public boolean hasActual() {
        return isFinite(actual);
    }

    public boolean hasForecast() {
        return isFinite(forecast);
    }

    public static boolean isFinite(Double value) {
        return value != null && Double.isFinite(value);
    }

    /** NaN and infinities are treated as missing. */
    public static Double finiteOrNull(Double value) {
        return isFinite(value) ? value : null;
    }
}
