package com.forecastaccuracy.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class CreateRunRequest {

    @NotBlank(message = "streamKey is required")
    String streamKey;

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate startDate;

    @Min(value = 1, message = "horizonDays must be between 1 and 3650")
    @Max(value = 3650, message = "horizonDays must be between 1 and 3650")
    Integer horizonDays;

    @Min(value = 1, message = "historyDays must be between 1 and 3650")
    @Max(value = 3650, message = "historyDays must be between 1 and 3650")
    Integer historyDays;

    @Min(value = 1, message = "backtestDays must be between 1 and 3650")
    @Max(value = 3650, message = "backtestDays must be between 1 and 3650")
    Integer backtestDays;
}
