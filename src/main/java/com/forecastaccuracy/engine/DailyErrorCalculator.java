package com.forecastaccuracy.engine;

import com.forecastaccuracy.model.DailyError;
import com.forecastaccuracy.model.TimePoint;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Inner-joins actuals and forecasts by date. Dates missing a finite value on either
 * side produce no record. Output is in ascending date order.
 */
@Component
public class DailyErrorCalculator {

    public List<DailyError> computeDailyErrors(List<TimePoint> actuals, List<TimePoint> forecasts, double floor) {
        Map<LocalDate, Double> actualByDate = new TreeMap<>();
        for (TimePoint p : actuals) {
            if (p.getDate() != null && p.hasActual()) {
                actualByDate.put(p.getDate(), p.getActual());
            }
        }

        Map<LocalDate, Double> forecastByDate = new TreeMap<>();
        for (TimePoint p : forecasts) {
            if (p.getDate() != null && p.hasForecast()) {
                forecastByDate.put(p.getDate(), p.getForecast());
            }
        }

        List<DailyError> out = new ArrayList<>();
        for (Map.Entry<LocalDate, Double> e : actualByDate.entrySet()) {
            Double forecast = forecastByDate.get(e.getKey());
            if (forecast == null) {
                continue;
            }
            out.add(DailyError.of(e.getKey(), e.getValue(), forecast, floor));
        }
        return out;
    }
}
