package com.forecastaccuracy.model;

import lombok.Builder;
import lombok.Value;

/**
 * Window-level accuracy KPIs. The {@code *Pct} fields are already multiplied by 100
 * and stay null whenever their denominator is degenerate or the window is empty.
 */
@Value
@Builder
public class MetricsSummary {
    BacktestWindow window;
    int n;
    int nonzeroActualDays;
    int zeroActualDays;
    double apeDenominatorFloor;
    Double mapePct;
    Double smapePct;
    Double wapePct;
    Double biasPct;

    public static MetricsSummary empty(BacktestWindow window, double floor) {
        return MetricsSummary.builder()
            .window(window)
            .n(0)
            .apeDenominatorFloor(floor)
            .build();
    }
}
