package com.forecastaccuracy.engine;

import com.forecastaccuracy.model.BacktestWindow;
import com.forecastaccuracy.model.TimePoint;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Walk-forward persistence baseline: the forecast for a window day is the last actual
 * observed before it. The first window day is seeded with the last actual before the
 * window, or 0 when there is no history.
 */
@Component
public class NaiveBaselineForecaster {

    public List<TimePoint> forecast(List<TimePoint> actuals, BacktestWindow window) {
        if (!window.isAnchored()) {
            return List.of();
        }

        Map<LocalDate, Double> byDate = new TreeMap<>();
        for (TimePoint p : actuals) {
            if (p.getDate() != null && p.hasActual()) {
                byDate.put(p.getDate(), p.getActual());
            }
        }

        double previous = 0.0;
        List<TimePoint> out = new ArrayList<>();
        for (Map.Entry<LocalDate, Double> e : byDate.entrySet()) {
            if (e.getKey().isBefore(window.from())) {
                previous = e.getValue();
                continue;
            }
            if (e.getKey().isAfter(window.to())) {
                break;
            }
            out.add(TimePoint.forecast(e.getKey(), previous, null, null));
            previous = e.getValue();
        }
        return out;
    }
}
