package com.forecastaccuracy.dto;

import com.forecastaccuracy.model.BacktestWindow;
import com.forecastaccuracy.model.DailyError;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class MetricsResponse {
    UUID runId;
    String streamKey;
    String method;
    BacktestWindow window;
    Metrics metrics;
    List<DailyError> dailyErrors;

    @Value
    @Builder
    public static class Metrics {
        int n;
        int nonzeroActualDays;
        int zeroActualDays;
        double apeDenominatorFloor;
        Double mapePct;
        Double smapePct;
        Double wapePct;
        Double biasPct;
    }
}
