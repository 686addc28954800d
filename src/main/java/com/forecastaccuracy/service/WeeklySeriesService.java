package com.forecastaccuracy.service;

import com.forecastaccuracy.dto.SeriesRequest;
import com.forecastaccuracy.dto.WeeklySeriesResponse;
import com.forecastaccuracy.engine.QuantileBandReconciler;
import com.forecastaccuracy.engine.TemporalAggregator;
import com.forecastaccuracy.model.TimePoint;
import com.forecastaccuracy.model.WeeklyBucket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class WeeklySeriesService {

    private static final double MAX_UTILIZATION_PCT = 250.0;

    private final QuantileBandReconciler bandReconciler;
    private final TemporalAggregator     temporalAggregator;
    private final SeriesPointMapper      pointMapper;

    @Value("${planning.kg-per-fte-week:6500}")
    private double kgPerFteWeek;

    @Value("${planning.base-fte:10}")
    private double baseFte;

    @Value("${planning.cost-per-fte-week:2500}")
    private double costPerFteWeek;

    @Value("${planning.opportunity-rate:0.05}")
    private double opportunityRate;

    public WeeklySeriesResponse weekly(SeriesRequest request) {
        return weekly(pointMapper.toActuals(request.getActuals()), pointMapper.toForecasts(request.getForecast()));
    }

    public WeeklySeriesResponse weekly(List<TimePoint> actuals, List<TimePoint> forecasts) {
        List<TimePoint> daily = new ArrayList<>(actuals.size() + forecasts.size());
        for (TimePoint a : actuals) {
            daily.add(TimePoint.actual(a.getDate(), a.getActual()));
        }
        for (TimePoint f : forecasts) {
            daily.add(bandReconciler.reconcile(
                TimePoint.forecast(f.getDate(), f.getForecast(), f.getP05(), f.getP95())));
        }

        List<WeeklySeriesResponse.WeeklyPoint> weeks = new ArrayList<>();
        List<WeeklySeriesResponse.StaffingRow> staffing = new ArrayList<>();
        double savingsTotal = 0.0;
        boolean hasQuantiles = false;

        for (WeeklyBucket raw : temporalAggregator.bucketToWeeks(daily)) {
            WeeklyBucket b = bandReconciler.reconcileWeekly(raw);
            weeks.add(toWeeklyPoint(b));

            WeeklySeriesResponse.StaffingRow row = staffingRow(b);
            staffing.add(row);
            savingsTotal += row.getSavings();
            hasQuantiles |= b.getP05Sum() != null && b.getP95Sum() != null;
        }

        log.debug("Weekly series built | weeks={} | savingsTotal={} | hasQuantiles={}",
            weeks.size(), savingsTotal, hasQuantiles);

        return WeeklySeriesResponse.builder()
            .weeks(weeks)
            .staffing(staffing)
            .savingsTotal(round2(savingsTotal))
            .hasQuantiles(hasQuantiles)
            .build();
    }

    private WeeklySeriesResponse.WeeklyPoint toWeeklyPoint(WeeklyBucket b) {
        Double base = b.getForecastSum() != null ? b.getForecastSum() : b.getActualSum();
        return WeeklySeriesResponse.WeeklyPoint.builder()
            .week(b.getWeekKey())
            .iso(b.getFirstDate())
            .actual(b.getActualSum())
            .forecast(b.getForecastSum())
            .p05(b.getP05Sum())
            .p95(b.getP95Sum())
            .opportunities(base != null ? round2(Math.max(0.0, base * opportunityRate)) : null)
            .build();
    }

    private WeeklySeriesResponse.StaffingRow staffingRow(WeeklyBucket b) {
        double forecastKg = b.getForecastSum() != null ? b.getForecastSum() : 0.0;
        double fteNeeded = forecastKg > 0 ? forecastKg / kgPerFteWeek : 0.0;
        double utilization = baseFte > 0 ? fteNeeded / baseFte * 100.0 : 0.0;
        double savings = Math.max(0.0, baseFte - fteNeeded) * costPerFteWeek;
        return WeeklySeriesResponse.StaffingRow.builder()
            .week(b.getWeekKey())
            .forecastKg(round2(forecastKg))
            .fteNeeded(round2(fteNeeded))
            .utilizationPct(round2(Math.min(MAX_UTILIZATION_PCT, Math.max(0.0, utilization))))
            .baseFte(baseFte)
            .savings(round2(savings))
            .build();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
