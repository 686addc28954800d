package com.forecastaccuracy.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.forecastaccuracy.model.DailyError;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DashboardResponse {
    String seriesKey;
    long generation;
    boolean stale;
    SliceResult<MetricsResponse> kpis;
    SliceResult<List<DailyError>> dailyErrors;
    SliceResult<List<DailyError>> outliers;
}
