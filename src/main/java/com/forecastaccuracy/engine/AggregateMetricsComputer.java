package com.forecastaccuracy.engine;

import com.forecastaccuracy.model.BacktestWindow;
import com.forecastaccuracy.model.DailyError;
import com.forecastaccuracy.model.DailySmape;
import com.forecastaccuracy.model.MetricsSummary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces daily errors to WAPE, MAPE, sMAPE and Bias. Each metric is computed
 * independently; a degenerate denominator nulls only that metric.
 */
@Component
public class AggregateMetricsComputer {

    public MetricsSummary computeSummary(List<DailyError> dailyErrors, BacktestWindow window, double floor) {
        if (dailyErrors.isEmpty()) {
            return MetricsSummary.empty(window, floor);
        }

        double absErrorSum = 0.0;
        double errorSum = 0.0;
        double actualSum = 0.0;
        double apeSum = 0.0;
        int apeCount = 0;
        double smapeSum = 0.0;
        int smapeCount = 0;
        int nonzero = 0;
        int zero = 0;

        for (DailyError d : dailyErrors) {
            absErrorSum += d.getAbsError();
            errorSum += d.getError();
            actualSum += d.getActual();
            if (d.getApe() != null) {
                apeSum += d.getApe();
                apeCount++;
            }
            Double smape = smapeTerm(d);
            if (smape != null) {
                smapeSum += smape;
                smapeCount++;
            }
            if (d.getActual() != 0.0d) {
                nonzero++;
            } else {
                zero++;
            }
        }

        return MetricsSummary.builder()
            .window(window)
            .n(dailyErrors.size())
            .nonzeroActualDays(nonzero)
            .zeroActualDays(zero)
            .apeDenominatorFloor(floor)
            .mapePct(apeCount > 0 ? 100.0 * apeSum / apeCount : null)
            .smapePct(smapeCount > 0 ? 100.0 * smapeSum / smapeCount : null)
            .wapePct(actualSum != 0.0d ? 100.0 * absErrorSum / actualSum : null)
            .biasPct(actualSum != 0.0d ? 100.0 * errorSum / actualSum : null)
            .build();
    }

    /**
     * Per-day sMAPE series, as a ratio (not x100). Days whose denominator is zero are left out.
     */
    public List<DailySmape> dailySmape(List<DailyError> dailyErrors) {
        List<DailySmape> out = new ArrayList<>(dailyErrors.size());
        for (DailyError d : dailyErrors) {
            Double smape = smapeTerm(d);
            if (smape != null) {
                out.add(new DailySmape(d.getDate(), smape));
            }
        }
        return out;
    }

    static Double smapeTerm(DailyError d) {
        double denom = Math.abs(d.getActual()) + Math.abs(d.getForecast());
        return denom != 0.0d ? 2.0 * d.getAbsError() / denom : null;
    }
}
