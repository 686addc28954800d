package com.forecastaccuracy.controller;

import com.forecastaccuracy.config.RequestIds;
import com.forecastaccuracy.dto.BaselineRequest;
import com.forecastaccuracy.dto.DailySmapeResponse;
import com.forecastaccuracy.dto.DashboardResponse;
import com.forecastaccuracy.dto.EvaluationRequest;
import com.forecastaccuracy.dto.MetricsResponse;
import com.forecastaccuracy.dto.SeriesRequest;
import com.forecastaccuracy.dto.WeeklySeriesResponse;
import com.forecastaccuracy.service.DashboardService;
import com.forecastaccuracy.service.ForecastMetricsService;
import com.forecastaccuracy.service.WeeklySeriesService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Stateless evaluation of caller-supplied actual and forecast series.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final ForecastMetricsService metricsService;
    private final DashboardService       dashboardService;
    private final WeeklySeriesService    weeklySeriesService;

    @PostMapping("/evaluate")
    public ResponseEntity<MetricsResponse> evaluate(
            @Valid @RequestBody EvaluationRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIds.resolve(httpRequest);
        log.info("POST /metrics/evaluate | actuals={} | forecast={} | start={} | requestId={}",
            request.getActuals().size(), request.getForecast().size(), request.getStartDate(), requestId);
        return ResponseEntity.ok(metricsService.evaluate(request));
    }

    @PostMapping("/naive")
    public ResponseEntity<MetricsResponse> naive(
            @Valid @RequestBody BaselineRequest request, HttpServletRequest httpRequest) {
        log.info("POST /metrics/naive | actuals={} | start={} | requestId={}",
            request.getActuals().size(), request.getStartDate(), RequestIds.resolve(httpRequest));
        return ResponseEntity.ok(metricsService.evaluateNaive(request));
    }

    @PostMapping("/dashboard")
    public Mono<ResponseEntity<DashboardResponse>> dashboard(
            @Valid @RequestBody EvaluationRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIds.resolve(httpRequest);
        log.info("POST /metrics/dashboard | seriesKey={} | generation={} | requestId={}",
            request.getSeriesKey(), request.getGeneration(), requestId);
        return dashboardService.dashboard(request, requestId).map(ResponseEntity::ok);
    }

    @PostMapping("/weekly")
    public ResponseEntity<WeeklySeriesResponse> weekly(
            @Valid @RequestBody SeriesRequest request, HttpServletRequest httpRequest) {
        log.info("POST /metrics/weekly | actuals={} | forecast={} | requestId={}",
            request.getActuals().size(), request.getForecast().size(), RequestIds.resolve(httpRequest));
        return ResponseEntity.ok(weeklySeriesService.weekly(request));
    }

    @PostMapping("/daily-smape")
    public ResponseEntity<DailySmapeResponse> dailySmape(
            @Valid @RequestBody EvaluationRequest request, HttpServletRequest httpRequest) {
        log.info("POST /metrics/daily-smape | start={} | requestId={}",
            request.getStartDate(), RequestIds.resolve(httpRequest));
        return ResponseEntity.ok(metricsService.dailySmape(request));
    }
}
