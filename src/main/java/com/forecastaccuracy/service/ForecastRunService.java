package com.forecastaccuracy.service;

import com.forecastaccuracy.client.ForecasterClient;
import com.forecastaccuracy.dto.ActualPointDto;
import com.forecastaccuracy.dto.CreateRunRequest;
import com.forecastaccuracy.dto.ForecastPointDto;
import com.forecastaccuracy.dto.MetricsResponse;
import com.forecastaccuracy.dto.RunResponse;
import com.forecastaccuracy.dto.RunSeriesResponse;
import com.forecastaccuracy.dto.WeeklySeriesResponse;
import com.forecastaccuracy.entity.ForecastRun;
import com.forecastaccuracy.entity.RunSeriesPoint;
import com.forecastaccuracy.entity.RunStatus;
import com.forecastaccuracy.entity.SeriesKind;
import com.forecastaccuracy.exception.ForecasterApiException;
import com.forecastaccuracy.exception.RunNotFoundException;
import com.forecastaccuracy.exception.RunNotReadyException;
import com.forecastaccuracy.model.TimePoint;
import com.forecastaccuracy.repository.ForecastRunRepository;
import com.forecastaccuracy.repository.RunSeriesPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Forecast runs: snapshots of actuals and forecast fetched from the upstream
 * forecaster for one stream and start date, evaluated on demand.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastRunService {

    static final String JOB_TYPE = "FORECAST_RUN";

    private final ForecastRunRepository    runRepository;
    private final RunSeriesPointRepository pointRepository;
    private final ForecasterClient         forecasterClient;
    private final SeriesPointMapper        pointMapper;
    private final StreamKeyResolver        streamKeyResolver;
    private final AsyncJobService          asyncJobService;
    private final ForecastMetricsService   metricsService;
    private final WeeklySeriesService      weeklySeriesService;

    @Value("${runs.default-horizon-days:28}")
    private int defaultHorizonDays;

    @Value("${runs.default-history-days:90}")
    private int defaultHistoryDays;

    @Value("${runs.default-backtest-days:56}")
    private int defaultBacktestDays;

    @Value("${metrics.default-daily-errors-limit:120}")
    private int defaultDailyErrorsLimit;

    public RunResponse createRun(CreateRunRequest request, String requestId) {
        String streamKey = streamKeyResolver.resolve(request.getStreamKey());
        ForecastRun run = runRepository.save(ForecastRun.builder()
            .streamKey(streamKey)
            .startDate(request.getStartDate() != null ? request.getStartDate() : LocalDate.now())
            .horizonDays(request.getHorizonDays() != null ? request.getHorizonDays() : defaultHorizonDays)
            .historyDays(request.getHistoryDays() != null ? request.getHistoryDays() : defaultHistoryDays)
            .backtestDays(request.getBacktestDays() != null ? request.getBacktestDays() : defaultBacktestDays)
            .status(RunStatus.QUEUED)
            .message("Queued")
            .requestId(requestId)
            .build());

        UUID runId = run.getId();
        UUID jobId = asyncJobService.submit(JOB_TYPE, requestId, progress -> execute(runId, progress));
        log.info("Run created | id={} | stream={} | start={} | jobId={} | requestId={}",
            runId, streamKey, run.getStartDate(), jobId, requestId);
        return toResponse(run, jobId);
    }

    RunResponse execute(UUID runId, JobProgress progress) {
        ForecastRun run = runRepository.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
        run.setStatus(RunStatus.RUNNING);
        run.setStartedAt(Instant.now());
        run.setMessage("Fetching actuals");
        runRepository.save(run);

        try {
            progress.report("Fetching actuals", 10);
            List<ActualPointDto> rawActuals = forecasterClient.fetchActuals(run.getStreamKey(), run.getRequestId())
                .blockOptional()
                .orElseThrow(() -> new ForecasterApiException("Forecaster returned an empty actuals response"));

            progress.report("Fetching forecast", 40);
            LocalDate forecastFrom = run.getStartDate().minusDays(run.getBacktestDays());
            List<ForecastPointDto> rawForecast = forecasterClient.fetchForecast(
                    run.getStreamKey(), forecastFrom, run.getBacktestDays() + run.getHorizonDays(), run.getRequestId())
                .blockOptional()
                .orElseThrow(() -> new ForecasterApiException("Forecaster returned an empty forecast response"));

            progress.report("Storing snapshot", 70);
            List<TimePoint> actuals = historySlice(pointMapper.toActuals(rawActuals), run);
            List<TimePoint> forecasts = pointMapper.toForecasts(rawForecast);
            pointRepository.saveAll(toRows(run, actuals, forecasts));

            run.setStatus(RunStatus.SUCCESS);
            run.setFinishedAt(Instant.now());
            run.setMessage("Stored " + actuals.size() + " actual and " + forecasts.size() + " forecast points");
            runRepository.save(run);
            log.info("Run finished | id={} | stream={} | actuals={} | forecast={} | requestId={}",
                runId, run.getStreamKey(), actuals.size(), forecasts.size(), run.getRequestId());
            return toResponse(run, null);
        } catch (RuntimeException ex) {
            run.setStatus(RunStatus.FAILED);
            run.setFinishedAt(Instant.now());
            run.setMessage("Run failed");
            run.setError(truncate(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName()));
            runRepository.save(run);
            log.warn("Run failed | id={} | stream={} | error={} | requestId={}",
                runId, run.getStreamKey(), run.getError(), run.getRequestId());
            throw ex;
        }
    }

    @Transactional(readOnly = true)
    public RunResponse getRun(UUID runId) {
        return toResponse(findRun(runId), null);
    }

    @Transactional(readOnly = true)
    public Page<RunResponse> listRuns(String streamKey, Pageable pageable) {
        Page<ForecastRun> page = streamKey == null
            ? runRepository.findAllByOrderByCreatedAtDesc(pageable)
            : runRepository.findByStreamKeyOrderByCreatedAtDesc(streamKeyResolver.resolve(streamKey), pageable);
        return page.map(r -> toResponse(r, null));
    }

    @Transactional(readOnly = true)
    public RunSeriesResponse getSeries(UUID runId) {
        Snapshot snapshot = loadSnapshot(runId);
        return RunSeriesResponse.builder()
            .runId(runId)
            .streamKey(snapshot.run().getStreamKey())
            .actuals(snapshot.actuals().stream()
                .map(p -> new RunSeriesResponse.ActualPoint(p.getDate(), p.getActual()))
                .toList())
            .forecast(snapshot.forecasts().stream()
                .map(p -> new RunSeriesResponse.ForecastPoint(p.getDate(), p.getForecast(), p.getP05(), p.getP95()))
                .toList())
            .build();
    }

    @Transactional(readOnly = true)
    public MetricsResponse runMetrics(
            UUID runId, Integer backtestDays, Boolean includeDailyErrors, Integer dailyErrorsLimit, Boolean outliersOnly) {
        Snapshot snapshot = loadSnapshot(runId);
        EvaluationOptions options = runOptions(snapshot.run(), backtestDays, includeDailyErrors, dailyErrorsLimit, outliersOnly);
        return withRun(metricsService.evaluate(snapshot.actuals(), snapshot.forecasts(), options,
            ForecastMetricsService.METHOD_RUN_SNAPSHOT), snapshot.run());
    }

    /** Same window as {@link #runMetrics}, scored against the last-value baseline of the stored actuals. */
    @Transactional(readOnly = true)
    public MetricsResponse runNaiveMetrics(
            UUID runId, Integer backtestDays, Boolean includeDailyErrors, Integer dailyErrorsLimit, Boolean outliersOnly) {
        Snapshot snapshot = loadSnapshot(runId);
        EvaluationOptions options = runOptions(snapshot.run(), backtestDays, includeDailyErrors, dailyErrorsLimit, outliersOnly);
        return withRun(metricsService.evaluateNaive(snapshot.actuals(), options), snapshot.run());
    }

    @Transactional(readOnly = true)
    public WeeklySeriesResponse runWeekly(UUID runId) {
        Snapshot snapshot = loadSnapshot(runId);
        return weeklySeriesService.weekly(snapshot.actuals(), snapshot.forecasts());
    }

    private EvaluationOptions runOptions(ForecastRun run, Integer backtestDays, Boolean includeDailyErrors,
                                         Integer dailyErrorsLimit, Boolean outliersOnly) {
        return new EvaluationOptions(
            run.getStartDate(),
            backtestDays != null ? backtestDays : run.getBacktestDays(),
            includeDailyErrors == null || includeDailyErrors,
            dailyErrorsLimit != null ? dailyErrorsLimit : defaultDailyErrorsLimit,
            Boolean.TRUE.equals(outliersOnly));
    }

    private static MetricsResponse withRun(MetricsResponse response, ForecastRun run) {
        return response.toBuilder()
            .runId(run.getId())
            .streamKey(run.getStreamKey())
            .build();
    }

    private ForecastRun findRun(UUID runId) {
        return runRepository.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private Snapshot loadSnapshot(UUID runId) {
        ForecastRun run = findRun(runId);
        if (run.getStatus() != RunStatus.SUCCESS) {
            throw new RunNotReadyException(runId, run.getStatus().name());
        }
        List<TimePoint> actuals = pointRepository.findByRunIdAndKindOrderByPointDateAsc(runId, SeriesKind.ACTUAL)
            .stream()
            .map(p -> TimePoint.actual(p.getPointDate(), p.getValue()))
            .toList();
        List<TimePoint> forecasts = pointRepository.findByRunIdAndKindOrderByPointDateAsc(runId, SeriesKind.FORECAST)
            .stream()
            .map(p -> TimePoint.forecast(p.getPointDate(), p.getValue(), p.getP05(), p.getP95()))
            .toList();
        return new Snapshot(run, actuals, forecasts);
    }

    /**
     * Keeps the actuals before the start date, at most {@code max(history, backtest)} days
     * back from the last observed day, so the backtest window is always covered.
     */
    private List<TimePoint> historySlice(List<TimePoint> actuals, ForecastRun run) {
        LocalDate beforeStart = run.getStartDate().minusDays(1);
        LocalDate end = actuals.stream()
            .filter(TimePoint::hasActual)
            .map(TimePoint::getDate)
            .filter(d -> !d.isAfter(beforeStart))
            .max(Comparator.naturalOrder())
            .orElse(beforeStart);
        LocalDate from = end.minusDays(Math.max(run.getHistoryDays(), run.getBacktestDays()) - 1L);
        return actuals.stream()
            .filter(p -> !p.getDate().isBefore(from) && !p.getDate().isAfter(end))
            .toList();
    }

    private List<RunSeriesPoint> toRows(ForecastRun run, List<TimePoint> actuals, List<TimePoint> forecasts) {
        List<RunSeriesPoint> rows = new ArrayList<>(actuals.size() + forecasts.size());
        for (TimePoint a : actuals) {
            rows.add(RunSeriesPoint.builder()
                .run(run).pointDate(a.getDate()).kind(SeriesKind.ACTUAL).value(a.getActual())
                .build());
        }
        for (TimePoint f : forecasts) {
            rows.add(RunSeriesPoint.builder()
                .run(run).pointDate(f.getDate()).kind(SeriesKind.FORECAST).value(f.getForecast())
                .p05(f.getP05()).p95(f.getP95())
                .build());
        }
        return rows;
    }

    private RunResponse toResponse(ForecastRun r, UUID jobId) {
        String self = "/api/v1/runs/" + r.getId();
        Map<String, String> links = new LinkedHashMap<>();
        links.put("self", self);
        if (r.getStatus() == RunStatus.SUCCESS) {
            links.put("series", self + "/series");
            links.put("metrics", self + "/metrics");
            links.put("naive_metrics", self + "/metrics/naive");
            links.put("weekly", self + "/weekly");
        }
        if (jobId != null) {
            links.put("job", "/api/v1/jobs/" + jobId);
        }
        return RunResponse.builder()
            .id(r.getId())
            .streamKey(r.getStreamKey())
            .status(r.getStatus())
            .startDate(r.getStartDate())
            .horizonDays(r.getHorizonDays())
            .historyDays(r.getHistoryDays())
            .backtestDays(r.getBacktestDays())
            .createdAt(r.getCreatedAt() != null ? r.getCreatedAt() : Instant.now())
            .startedAt(r.getStartedAt())
            .finishedAt(r.getFinishedAt())
            .message(r.getMessage())
            .error(r.getError())
            .jobId(jobId)
            .requestId(r.getRequestId())
            .links(links)
            .build();
    }

    private static String truncate(String value) {
        return value.length() <= 2000 ? value : value.substring(0, 2000);
    }

    private record Snapshot(ForecastRun run, List<TimePoint> actuals, List<TimePoint> forecasts) {}
}
