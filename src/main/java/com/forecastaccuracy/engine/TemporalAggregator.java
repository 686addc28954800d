package com.forecastaccuracy.engine;

import com.forecastaccuracy.model.TimePoint;
import com.forecastaccuracy.model.WeeklyBucket;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.WeekFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sums daily points into ISO-8601 weeks ({@code YYYY-Www}, Monday start).
 * Negative values are floored at 0 before summation.
 */
@Component
public class TemporalAggregator {

    public List<WeeklyBucket> bucketToWeeks(List<TimePoint> points) {
        Map<String, Accumulator> byWeek = new TreeMap<>();
        for (TimePoint p : points) {
            if (p.getDate() == null || !hasAnyValue(p)) {
                continue;
            }
            byWeek.computeIfAbsent(isoWeekKey(p.getDate()), k -> new Accumulator(p.getDate()))
                .add(p);
        }

        List<WeeklyBucket> out = new ArrayList<>(byWeek.size());
        byWeek.forEach((week, acc) -> out.add(acc.toBucket(week)));
        return out;
    }

    private static boolean hasAnyValue(TimePoint p) {
        return TimePoint.isFinite(p.getActual()) || TimePoint.isFinite(p.getForecast())
            || TimePoint.isFinite(p.getP05()) || TimePoint.isFinite(p.getP95());
    }

    public static String isoWeekKey(LocalDate date) {
        int year = date.get(WeekFields.ISO.weekBasedYear());
        int week = date.get(WeekFields.ISO.weekOfWeekBasedYear());
        return String.format("%04d-W%02d", year, week);
    }

    private static final class Accumulator {
        private LocalDate firstDate;
        private final Sum actual = new Sum();
        private final Sum forecast = new Sum();
        private final Sum p05 = new Sum();
        private final Sum p95 = new Sum();

        private Accumulator(LocalDate firstDate) {
            this.firstDate = firstDate;
        }

        private void add(TimePoint p) {
            if (p.getDate().isBefore(firstDate)) {
                firstDate = p.getDate();
            }
            actual.add(p.getActual());
            forecast.add(p.getForecast());
            p05.add(p.getP05());
            p95.add(p.getP95());
        }

        private WeeklyBucket toBucket(String week) {
            return WeeklyBucket.builder()
                .weekKey(week)
                .firstDate(firstDate)
                .actualSum(actual.valueOrNull())
                .forecastSum(forecast.valueOrNull())
                .p05Sum(p05.valueOrNull())
                .p95Sum(p95.valueOrNull())
                .build();
        }
    }

    /** Running sum plus the number of days that contributed to it. */
    private static final class Sum {
        private double total;
        private int count;

        private void add(Double value) {
            if (!TimePoint.isFinite(value)) {
                return;
            }
            total += Math.max(0.0, value);
            count++;
        }

        private Double valueOrNull() {
            return count > 0 ? total : null;
        }
    }
}
