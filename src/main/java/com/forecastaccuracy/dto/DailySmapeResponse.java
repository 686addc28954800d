package com.forecastaccuracy.dto;

import com.forecastaccuracy.model.BacktestWindow;
import com.forecastaccuracy.model.DailySmape;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DailySmapeResponse {
    BacktestWindow window;
    double apeDenominatorFloor;
    List<DailySmape> points;
}
