package com.forecastaccuracy.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class RunSeriesResponse {
    UUID runId;
    String streamKey;
    List<ActualPoint> actuals;
    List<ForecastPoint> forecast;

    public record ActualPoint(@JsonFormat(pattern = "yyyy-MM-dd") LocalDate date, Double value) {}

    public record ForecastPoint(
        @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date, Double forecast, Double p05, Double p95) {}
}
