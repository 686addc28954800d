package com.forecastaccuracy.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

/**
 * Inclusive date range the floor and summary metrics are computed over.
 * Both bounds are null when there was nothing to anchor the window to.
 */
public record BacktestWindow(
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate from,
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate to,
    int backtestDays
) {

    public static BacktestWindow beforeStart(LocalDate startDate, int backtestDays) {
        return new BacktestWindow(startDate.minusDays(backtestDays), startDate.minusDays(1), backtestDays);
    }

    public static BacktestWindow endingOn(LocalDate lastDate, int backtestDays) {
        return new BacktestWindow(lastDate.minusDays(backtestDays - 1L), lastDate, backtestDays);
    }

    public static BacktestWindow unanchored(int backtestDays) {
        return new BacktestWindow(null, null, backtestDays);
    }

    public boolean isAnchored() {
        return from != null && to != null;
    }

    public boolean contains(LocalDate date) {
        return isAnchored() && date != null && !date.isBefore(from) && !date.isAfter(to);
    }
}
