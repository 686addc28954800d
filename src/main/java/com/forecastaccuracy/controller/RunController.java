package com.forecastaccuracy.controller;

import com.forecastaccuracy.config.RequestIds;
import com.forecastaccuracy.dto.AsyncJobResponse;
import com.forecastaccuracy.dto.CreateRunRequest;
import com.forecastaccuracy.dto.MetricsResponse;
import com.forecastaccuracy.dto.RunResponse;
import com.forecastaccuracy.dto.RunSeriesResponse;
import com.forecastaccuracy.dto.WeeklySeriesResponse;
import com.forecastaccuracy.service.AsyncJobService;
import com.forecastaccuracy.service.ForecastRunService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RunController {

    private final ForecastRunService runService;
    private final AsyncJobService    asyncJobService;

    @PostMapping("/runs")
    public ResponseEntity<RunResponse> createRun(
            @Valid @RequestBody CreateRunRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIds.resolve(httpRequest);
        log.info("POST /runs | stream={} | start={} | horizon={} | requestId={}",
            request.getStreamKey(), request.getStartDate(), request.getHorizonDays(), requestId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(runService.createRun(request, requestId));
    }

    @GetMapping("/runs")
    public ResponseEntity<Page<RunResponse>> listRuns(
            @RequestParam(name = "stream_key", required = false) String streamKey,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(runService.listRuns(streamKey, PageRequest.of(page, size)));
    }

    @GetMapping("/runs/{id}")
    public ResponseEntity<RunResponse> getRun(@PathVariable UUID id) {
        return ResponseEntity.ok(runService.getRun(id));
    }

    @GetMapping("/runs/{id}/series")
    public ResponseEntity<RunSeriesResponse> getSeries(@PathVariable UUID id) {
        return ResponseEntity.ok(runService.getSeries(id));
    }

    @GetMapping("/runs/{id}/weekly")
    public ResponseEntity<WeeklySeriesResponse> getWeekly(@PathVariable UUID id) {
        return ResponseEntity.ok(runService.runWeekly(id));
    }

    @GetMapping("/runs/{id}/metrics")
    public ResponseEntity<MetricsResponse> getMetrics(
            @PathVariable UUID id,
            @RequestParam(name = "backtest_days", required = false) @Min(1) @Max(3650) Integer backtestDays,
            @RequestParam(name = "include_daily_errors", required = false) Boolean includeDailyErrors,
            @RequestParam(name = "daily_errors_limit", required = false) @Min(1) Integer dailyErrorsLimit,
            @RequestParam(name = "outliers_only", required = false) Boolean outliersOnly,
            HttpServletRequest httpRequest) {
        log.info("GET /runs/{}/metrics | backtestDays={} | outliersOnly={} | requestId={}",
            id, backtestDays, outliersOnly, RequestIds.resolve(httpRequest));
        return ResponseEntity.ok(
            runService.runMetrics(id, backtestDays, includeDailyErrors, dailyErrorsLimit, outliersOnly));
    }

    @GetMapping("/runs/{id}/metrics/naive")
    public ResponseEntity<MetricsResponse> getNaiveMetrics(
            @PathVariable UUID id,
            @RequestParam(name = "backtest_days", required = false) @Min(1) @Max(3650) Integer backtestDays,
            @RequestParam(name = "include_daily_errors", required = false) Boolean includeDailyErrors,
            @RequestParam(name = "daily_errors_limit", required = false) @Min(1) Integer dailyErrorsLimit,
            @RequestParam(name = "outliers_only", required = false) Boolean outliersOnly,
            HttpServletRequest httpRequest) {
        log.info("GET /runs/{}/metrics/naive | backtestDays={} | outliersOnly={} | requestId={}",
            id, backtestDays, outliersOnly, RequestIds.resolve(httpRequest));
        return ResponseEntity.ok(
            runService.runNaiveMetrics(id, backtestDays, includeDailyErrors, dailyErrorsLimit, outliersOnly));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> getJob(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }
}
