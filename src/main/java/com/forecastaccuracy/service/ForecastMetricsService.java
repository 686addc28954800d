package com.forecastaccuracy.service;

import com.forecastaccuracy.dto.BaselineRequest;
import com.forecastaccuracy.dto.DailySmapeResponse;
import com.forecastaccuracy.dto.EvaluationRequest;
import com.forecastaccuracy.dto.MetricsResponse;
import com.forecastaccuracy.engine.AggregateMetricsComputer;
import com.forecastaccuracy.engine.DailyErrorCalculator;
import com.forecastaccuracy.engine.DynamicFloorEstimator;
import com.forecastaccuracy.engine.NaiveBaselineForecaster;
import com.forecastaccuracy.engine.OutlierRanker;
import com.forecastaccuracy.model.BacktestWindow;
import com.forecastaccuracy.model.DailyError;
import com.forecastaccuracy.model.MetricsSummary;
import com.forecastaccuracy.model.TimePoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the accuracy engine over one actual/forecast pair: window, floor,
 * daily errors, summary and the requested daily-error slice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastMetricsService {

    public static final String METHOD_SUPPLIED = "supplied";
    public static final String METHOD_RUN_SNAPSHOT = "run_snapshot";
    public static final String METHOD_NAIVE = "naive_last_value";

    private final DynamicFloorEstimator    floorEstimator;
    private final DailyErrorCalculator     dailyErrorCalculator;
    private final AggregateMetricsComputer metricsComputer;
    private final OutlierRanker            outlierRanker;
    private final NaiveBaselineForecaster  naiveForecaster;
    private final SeriesPointMapper        pointMapper;

    @Value("${metrics.default-backtest-days:56}")
    private int defaultBacktestDays;

    @Value("${metrics.default-daily-errors-limit:120}")
    private int defaultDailyErrorsLimit;

    public MetricsResponse evaluate(EvaluationRequest request) {
        EvaluationOptions options = optionsFrom(request);
        List<TimePoint> actuals = pointMapper.toActuals(request.getActuals());
        List<TimePoint> forecasts = pointMapper.toForecasts(request.getForecast());
        return evaluate(actuals, forecasts, options, METHOD_SUPPLIED);
    }

    public MetricsResponse evaluate(
            List<TimePoint> actuals, List<TimePoint> forecasts, EvaluationOptions options, String method) {
        WindowErrors we = computeWindow(actuals, forecasts, options.startDate(), options.backtestDays());
        MetricsSummary summary = metricsComputer.computeSummary(we.dailyErrors(), we.window(), we.floor());

        log.debug("Metrics evaluated | window={}..{} | n={} | floor={} | wape={}",
            we.window().from(), we.window().to(), summary.getN(), we.floor(), summary.getWapePct());

        return MetricsResponse.builder()
            .method(method)
            .window(we.window())
            .metrics(toMetrics(summary))
            .dailyErrors(slice(we.dailyErrors(), options))
            .build();
    }

    public MetricsResponse evaluateNaive(BaselineRequest request) {
        EvaluationOptions options = new EvaluationOptions(
            request.getStartDate(),
            request.getBacktestDays() != null ? request.getBacktestDays() : defaultBacktestDays,
            request.getIncludeDailyErrors() == null || request.getIncludeDailyErrors(),
            request.getDailyErrorsLimit() != null ? request.getDailyErrorsLimit() : defaultDailyErrorsLimit,
            Boolean.TRUE.equals(request.getOutliersOnly()));
        return evaluateNaive(pointMapper.toActuals(request.getActuals()), options);
    }

    /** Evaluates the last-value baseline built from {@code actuals} over the same window. */
    public MetricsResponse evaluateNaive(List<TimePoint> actuals, EvaluationOptions options) {
        BacktestWindow window = resolveWindow(actuals, options.startDate(), options.backtestDays());
        return evaluate(actuals, naiveForecaster.forecast(actuals, window), options, METHOD_NAIVE);
    }

    public DailySmapeResponse dailySmape(EvaluationRequest request) {
        EvaluationOptions options = optionsFrom(request);
        WindowErrors we = computeWindow(
            pointMapper.toActuals(request.getActuals()),
            pointMapper.toForecasts(request.getForecast()),
            options.startDate(), options.backtestDays());
        return DailySmapeResponse.builder()
            .window(we.window())
            .apeDenominatorFloor(round(we.floor(), 4))
            .points(metricsComputer.dailySmape(we.dailyErrors()))
            .build();
    }

    public EvaluationOptions optionsFrom(EvaluationRequest request) {
        return new EvaluationOptions(
            request.getStartDate(),
            request.getBacktestDays() != null ? request.getBacktestDays() : defaultBacktestDays,
            request.getIncludeDailyErrors() == null || request.getIncludeDailyErrors(),
            request.getDailyErrorsLimit() != null ? request.getDailyErrorsLimit() : defaultDailyErrorsLimit,
            Boolean.TRUE.equals(request.getOutliersOnly()));
    }

    /**
     * With a start date the window is the {@code backtestDays} days before it; without one
     * it ends on the last day that has an actual value.
     */
    public BacktestWindow resolveWindow(List<TimePoint> actuals, LocalDate startDate, int backtestDays) {
        if (startDate != null) {
            return BacktestWindow.beforeStart(startDate, backtestDays);
        }
        return actuals.stream()
            .filter(p -> p.getDate() != null && p.hasActual())
            .map(TimePoint::getDate)
            .max(Comparator.naturalOrder())
            .map(last -> BacktestWindow.endingOn(last, backtestDays))
            .orElseGet(() -> BacktestWindow.unanchored(backtestDays));
    }

    WindowErrors computeWindow(
            List<TimePoint> actuals, List<TimePoint> forecasts, LocalDate startDate, int backtestDays) {
        BacktestWindow window = resolveWindow(actuals, startDate, backtestDays);
        double floor = floorEstimator.estimateFloor(actuals, window);
        List<TimePoint> windowActuals = actuals.stream().filter(p -> window.contains(p.getDate())).toList();
        List<TimePoint> windowForecasts = forecasts.stream().filter(p -> window.contains(p.getDate())).toList();
        return new WindowErrors(window, floor, dailyErrorCalculator.computeDailyErrors(windowActuals, windowForecasts, floor));
    }

    private List<DailyError> slice(List<DailyError> dailyErrors, EvaluationOptions options) {
        if (!options.includeDailyErrors() || dailyErrors.isEmpty()) {
            return List.of();
        }
        if (options.outliersOnly()) {
            return outlierRanker.rankOutliers(dailyErrors, options.dailyErrorsLimit());
        }
        int from = Math.max(0, dailyErrors.size() - options.dailyErrorsLimit());
        return List.copyOf(dailyErrors.subList(from, dailyErrors.size()));
    }

    private MetricsResponse.Metrics toMetrics(MetricsSummary s) {
        return MetricsResponse.Metrics.builder()
            .n(s.getN())
            .nonzeroActualDays(s.getNonzeroActualDays())
            .zeroActualDays(s.getZeroActualDays())
            .apeDenominatorFloor(round(s.getApeDenominatorFloor(), 4))
            .mapePct(round(s.getMapePct(), 2))
            .smapePct(round(s.getSmapePct(), 2))
            .wapePct(round(s.getWapePct(), 2))
            .biasPct(round(s.getBiasPct(), 2))
            .build();
    }

    private static Double round(Double value, int places) {
        return value == null ? null : round(value.doubleValue(), places);
    }

    private static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    record WindowErrors(BacktestWindow window, double floor, List<DailyError> dailyErrors) {}
}
