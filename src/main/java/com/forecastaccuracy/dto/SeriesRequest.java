package com.forecastaccuracy.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class SeriesRequest {
    @NotNull(message = "actuals is required")
    List<ActualPointDto> actuals;

    @NotNull(message = "forecast is required")
    List<ForecastPointDto> forecast;
}
