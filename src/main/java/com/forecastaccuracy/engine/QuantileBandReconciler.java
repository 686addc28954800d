package com.forecastaccuracy.engine;

import com.forecastaccuracy.model.TimePoint;
import com.forecastaccuracy.model.WeeklyBucket;
import org.springframework.stereotype.Component;

/**
 * Enforces {@code p05 <= forecast <= p95} on forecast points and weekly sums.
 * Negative values are floored at 0 and non-finite ones dropped.
 * Upper bands are additionally capped per day at three times
 * {@code max(1000, forecast)}.
 */
@Component
public class QuantileBandReconciler {

    static final double BAND_BASE_MIN = 1000.0;
    static final double BAND_CAP_MULTIPLIER = 3.0;

    public TimePoint reconcile(TimePoint point) {
        Double y = clip0(point.getForecast());
        Double p05 = clip0(point.getP05());
        Double p95 = clip0(point.getP95());

        if (y != null) {
            double bandBase = Math.max(BAND_BASE_MIN, Math.max(y, 1.0));
            if (p05 != null) {
                p05 = Math.min(p05, y);
            }
            if (p95 != null) {
                p95 = Math.max(y, Math.min(p95, bandBase * BAND_CAP_MULTIPLIER));
            }
            if (p05 != null && p95 != null && p05 > p95) {
                p05 = Math.min(y, p95);
            }
        }

        return point.toBuilder()
            .forecast(y)
            .p05(p05)
            .p95(p95)
            .build();
    }

    private static Double clip0(Double value) {
        return TimePoint.isFinite(value) ? Math.max(0.0, value) : null;
    }

    /**
     * Re-establishes ordering after summation. No plausibility cap here; caps were
     * applied per day before the sums were taken.
     */
    public WeeklyBucket reconcileWeekly(WeeklyBucket bucket) {
        Double y = bucket.getForecastSum();
        Double p05 = bucket.getP05Sum();
        Double p95 = bucket.getP95Sum();

        if (y != null) {
            if (p05 != null) {
                p05 = Math.min(Math.max(0.0, p05), y);
            }
            if (p95 != null) {
                p95 = Math.max(y, p95);
            }
        } else if (p05 != null && p95 != null && p05 > p95) {
            p05 = p95;
        }

        return bucket.toBuilder()
            .p05Sum(p05)
            .p95Sum(p95)
            .build();
    }
}
