package com.forecastaccuracy.engine;

import com.forecastaccuracy.model.BacktestWindow;
import com.forecastaccuracy.model.TimePoint;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives the smallest |actual| for which a percentage error is still meaningful.
 */
@Component
public class DynamicFloorEstimator {

    public static final double MIN_FLOOR = 1.0;
    public static final double MEDIAN_FRACTION = 0.01;

    public double estimateFloor(List<TimePoint> actuals, BacktestWindow window) {
        double[] nonZero = actuals.stream()
            .filter(p -> p.hasActual() && window.contains(p.getDate()))
            .mapToDouble(p -> Math.abs(p.getActual()))
            .filter(v -> v != 0.0d)
            .sorted()
            .toArray();
        if (nonZero.length == 0) {
            return MIN_FLOOR;
        }
        // upper median for even counts
        double median = nonZero[nonZero.length / 2];
        return Math.max(MIN_FLOOR, median * MEDIAN_FRACTION);
    }
}
