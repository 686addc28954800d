package com.forecastaccuracy.service;

import java.time.LocalDate;

/**
 * Parameters of one metrics evaluation after defaults were applied.
 */
public record EvaluationOptions(
    LocalDate startDate,
    int backtestDays,
    boolean includeDailyErrors,
    int dailyErrorsLimit,
    boolean outliersOnly
) {

    public EvaluationOptions {
        if (backtestDays < 1) {
            throw new IllegalArgumentException("backtestDays must be >= 1, was " + backtestDays);
        }
        if (dailyErrorsLimit < 1) {
            throw new IllegalArgumentException("dailyErrorsLimit must be >= 1, was " + dailyErrorsLimit);
        }
    }

    public EvaluationOptions summaryOnly() {
        return new EvaluationOptions(startDate, backtestDays, false, dailyErrorsLimit, false);
    }

    public EvaluationOptions chartSlice() {
        return new EvaluationOptions(startDate, backtestDays, true, dailyErrorsLimit, false);
    }

    public EvaluationOptions outlierSlice() {
        return new EvaluationOptions(startDate, backtestDays, true, dailyErrorsLimit, true);
    }
}
