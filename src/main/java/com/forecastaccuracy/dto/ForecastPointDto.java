package com.forecastaccuracy.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ForecastPointDto {
    String date;
    Double forecast;
    Double p05;
    Double p95;
}
