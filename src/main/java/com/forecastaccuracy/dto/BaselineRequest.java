package com.forecastaccuracy.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/** Actuals only; the forecast is derived from them by the naive baseline. */
@Value
@Builder
@Jacksonized
public class BaselineRequest {

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate startDate;

    @Min(value = 1, message = "backtestDays must be >= 1")
    @Max(value = 3650, message = "backtestDays must be <= 3650")
    Integer backtestDays;

    Boolean includeDailyErrors;

    @Min(value = 1, message = "dailyErrorsLimit must be >= 1")
    Integer dailyErrorsLimit;

    Boolean outliersOnly;

    @NotNull(message = "actuals is required")
    List<ActualPointDto> actuals;
}
