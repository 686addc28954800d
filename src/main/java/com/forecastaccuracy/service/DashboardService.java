package com.forecastaccuracy.service;

import com.forecastaccuracy.dto.DashboardResponse;
import com.forecastaccuracy.dto.EvaluationRequest;
import com.forecastaccuracy.dto.MetricsResponse;
import com.forecastaccuracy.dto.SliceResult;
import com.forecastaccuracy.model.DailyError;
import com.forecastaccuracy.model.TimePoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Computes the three dashboard slices (KPIs, chart errors, outliers) concurrently.
 * A failing slice reports its own error; a superseded request returns no data.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DashboardService {

    static final String DEFAULT_SERIES_KEY = "default";

    private final ForecastMetricsService   metricsService;
    private final SeriesPointMapper        pointMapper;
    private final RequestGenerationTracker generationTracker;

    public Mono<DashboardResponse> dashboard(EvaluationRequest request, String requestId) {
        String seriesKey = request.getSeriesKey() != null ? request.getSeriesKey() : DEFAULT_SERIES_KEY;
        long generation = generationTracker.register(seriesKey, request.getGeneration());

        EvaluationOptions options = metricsService.optionsFrom(request);
        List<TimePoint> actuals = pointMapper.toActuals(request.getActuals());
        List<TimePoint> forecasts = pointMapper.toForecasts(request.getForecast());
        String method = ForecastMetricsService.METHOD_SUPPLIED;

        Mono<SliceResult<MetricsResponse>> kpis = slice("kpis", requestId,
            () -> metricsService.evaluate(actuals, forecasts, options.summaryOnly(), method));
        Mono<SliceResult<List<DailyError>>> dailyErrors = slice("daily_errors", requestId,
            () -> metricsService.evaluate(actuals, forecasts, options.chartSlice(), method).getDailyErrors());
        Mono<SliceResult<List<DailyError>>> outliers = slice("outliers", requestId,
            () -> metricsService.evaluate(actuals, forecasts, options.outlierSlice(), method).getDailyErrors());

        return Mono.zip(kpis, dailyErrors, outliers)
            .map(t -> {
                if (!generationTracker.isCurrent(seriesKey, generation)) {
                    log.info("Dashboard result discarded | seriesKey={} | generation={} | latest={} | requestId={}",
                        seriesKey, generation, generationTracker.latest(seriesKey), requestId);
                    return DashboardResponse.builder()
                        .seriesKey(seriesKey).generation(generation).stale(true).build();
                }
                return DashboardResponse.builder()
                    .seriesKey(seriesKey)
                    .generation(generation)
                    .stale(false)
                    .kpis(t.getT1())
                    .dailyErrors(t.getT2())
                    .outliers(t.getT3())
                    .build();
            });
    }

    private <T> Mono<SliceResult<T>> slice(String name, String requestId, Callable<T> task) {
        return Mono.fromCallable(task)
            .subscribeOn(Schedulers.boundedElastic())
            .map(SliceResult::ok)
            .onErrorResume(ex -> {
                log.warn("Dashboard slice failed | slice={} | error={} | requestId={}",
                    name, ex.getMessage(), requestId);
                return Mono.just(SliceResult.<T>failed(
                    ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName()));
            });
    }
}
