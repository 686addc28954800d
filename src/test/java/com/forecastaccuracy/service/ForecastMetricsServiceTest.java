package com.forecastaccuracy.service;

import com.forecastaccuracy.dto.ActualPointDto;
import com.forecastaccuracy.dto.BaselineRequest;
import com.forecastaccuracy.dto.DailySmapeResponse;
import com.forecastaccuracy.dto.EvaluationRequest;
import com.forecastaccuracy.dto.ForecastPointDto;
import com.forecastaccuracy.dto.MetricsResponse;
import com.forecastaccuracy.engine.AggregateMetricsComputer;
import com.forecastaccuracy.engine.DailyErrorCalculator;
import com.forecastaccuracy.engine.DynamicFloorEstimator;
import com.forecastaccuracy.engine.NaiveBaselineForecaster;
import com.forecastaccuracy.engine.OutlierRanker;
import com.forecastaccuracy.model.DailyError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Percentage.withPercentage;

class ForecastMetricsServiceTest {

    static final LocalDate D1 = LocalDate.of(2024, 1, 1);

    private ForecastMetricsService service;

    static ForecastMetricsService newService() {
        SeriesPointMapper mapper = new SeriesPointMapper();
        ReflectionTestUtils.setField(mapper, "maxSeriesPoints", 20_000);
        ForecastMetricsService service = new ForecastMetricsService(
            new DynamicFloorEstimator(), new DailyErrorCalculator(),
            new AggregateMetricsComputer(), new OutlierRanker(), new NaiveBaselineForecaster(), mapper);
        ReflectionTestUtils.setField(service, "defaultBacktestDays", 56);
        ReflectionTestUtils.setField(service, "defaultDailyErrorsLimit", 120);
        return service;
    }

    static EvaluationRequest.EvaluationRequestBuilder twoDayRequest() {
        return EvaluationRequest.builder()
            .backtestDays(2)
            .actuals(List.of(
                ActualPointDto.builder().date("2024-01-01").value(0.0).build(),
                ActualPointDto.builder().date("2024-01-02").value(500.0).build()))
            .forecast(List.of(
                ForecastPointDto.builder().date("2024-01-01").forecast(50.0).build(),
                ForecastPointDto.builder().date("2024-01-02").forecast(480.0).build()));
    }

    private static EvaluationRequest.EvaluationRequestBuilder flatRequest(int days, double actual, double forecast) {
        List<ActualPointDto> actuals = new ArrayList<>();
        List<ForecastPointDto> forecasts = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            String date = D1.plusDays(i).toString();
            actuals.add(ActualPointDto.builder().date(date).value(actual).build());
            forecasts.add(ForecastPointDto.builder().date(date).forecast(forecast).build());
        }
        return EvaluationRequest.builder().actuals(actuals).forecast(forecasts);
    }

    @BeforeEach
    void setUp() {
        service = newService();
    }

    @Test
    void evaluate_twoDayScenario() {
        MetricsResponse resp = service.evaluate(twoDayRequest().build());

        assertThat(resp.getMethod()).isEqualTo("supplied");
        assertThat(resp.getWindow().from()).isEqualTo(D1);
        assertThat(resp.getWindow().to()).isEqualTo(D1.plusDays(1));

        MetricsResponse.Metrics m = resp.getMetrics();
        assertThat(m.getN()).isEqualTo(2);
        assertThat(m.getApeDenominatorFloor()).isEqualTo(5.0);
        assertThat(m.getMapePct()).isEqualTo(4.0);
        assertThat(m.getWapePct()).isEqualTo(14.0);
        assertThat(m.getBiasPct()).isEqualTo(6.0);
        assertThat(m.getSmapePct()).isEqualTo(102.04);

        assertThat(resp.getDailyErrors()).extracting(DailyError::getDate).containsExactly(D1, D1.plusDays(1));
        assertThat(resp.getDailyErrors().get(0).getApe()).isNull();
    }

    @Test
    void evaluate_outliersOnly_returnsRankedTopN() {
        MetricsResponse resp = service.evaluate(twoDayRequest().outliersOnly(true).dailyErrorsLimit(1).build());

        assertThat(resp.getDailyErrors()).hasSize(1);
        assertThat(resp.getDailyErrors().get(0).getDate()).isEqualTo(D1);
        assertThat(resp.getMetrics().getN()).isEqualTo(2);
    }

    @Test
    void evaluate_startDate_windowEndsTheDayBefore() {
        MetricsResponse resp = service.evaluate(
            flatRequest(30, 100.0, 110.0).startDate(LocalDate.of(2024, 1, 21)).backtestDays(7).build());

        assertThat(resp.getWindow().from()).isEqualTo(LocalDate.of(2024, 1, 14));
        assertThat(resp.getWindow().to()).isEqualTo(LocalDate.of(2024, 1, 20));
        assertThat(resp.getMetrics().getN()).isEqualTo(7);
        assertThat(resp.getMetrics().getWapePct()).isEqualTo(10.0);
        assertThat(resp.getMetrics().getApeDenominatorFloor()).isEqualTo(1.0);
    }

    @Test
    void evaluate_chartSlice_keepsLastRecordsInDateOrder() {
        MetricsResponse resp = service.evaluate(flatRequest(10, 100.0, 90.0).dailyErrorsLimit(3).build());

        assertThat(resp.getMetrics().getN()).isEqualTo(10);
        assertThat(resp.getDailyErrors()).extracting(DailyError::getDate)
            .containsExactly(D1.plusDays(7), D1.plusDays(8), D1.plusDays(9));
    }

    @Test
    void evaluate_dailyErrorsExcluded_stillComputesMetrics() {
        MetricsResponse resp = service.evaluate(twoDayRequest().includeDailyErrors(false).build());

        assertThat(resp.getDailyErrors()).isEmpty();
        assertThat(resp.getMetrics().getWapePct()).isEqualTo(14.0);
    }

    @Test
    void evaluate_noActuals_returnsEmptySummary() {
        MetricsResponse resp = service.evaluate(EvaluationRequest.builder()
            .actuals(List.of())
            .forecast(List.of(ForecastPointDto.builder().date("2024-01-01").forecast(5.0).build()))
            .build());

        assertThat(resp.getWindow().isAnchored()).isFalse();
        assertThat(resp.getWindow().backtestDays()).isEqualTo(56);
        assertThat(resp.getMetrics().getN()).isZero();
        assertThat(resp.getMetrics().getWapePct()).isNull();
        assertThat(resp.getMetrics().getApeDenominatorFloor()).isEqualTo(1.0);
    }

    @Test
    void optionsFrom_appliesDefaults() {
        EvaluationOptions options = service.optionsFrom(EvaluationRequest.builder()
            .actuals(List.of()).forecast(List.of()).build());

        assertThat(options.backtestDays()).isEqualTo(56);
        assertThat(options.includeDailyErrors()).isTrue();
        assertThat(options.dailyErrorsLimit()).isEqualTo(120);
        assertThat(options.outliersOnly()).isFalse();
        assertThat(options.startDate()).isNull();
    }

    @Test
    void dailySmape_returnsRatioPerDay() {
        DailySmapeResponse resp = service.dailySmape(twoDayRequest().build());

        assertThat(resp.getApeDenominatorFloor()).isEqualTo(5.0);
        assertThat(resp.getPoints()).hasSize(2);
        assertThat(resp.getPoints().get(0).smape()).isEqualTo(2.0);
    }

    @Test
    void evaluate_hugeRatios_areNotClippedByRounding() {
        MetricsResponse resp = service.evaluate(EvaluationRequest.builder()
            .backtestDays(2)
            .actuals(List.of(
                ActualPointDto.builder().date("2024-01-01").value(0.001).build(),
                ActualPointDto.builder().date("2024-01-02").value(0.0).build()))
            .forecast(List.of(
                ForecastPointDto.builder().date("2024-01-01").forecast(1e15).build(),
                ForecastPointDto.builder().date("2024-01-02").forecast(0.0).build()))
            .build());

        assertThat(resp.getMetrics().getWapePct()).isCloseTo(1e20, withPercentage(1e-6));
        assertThat(resp.getMetrics().getBiasPct()).isCloseTo(1e20, withPercentage(1e-6));
        assertThat(resp.getMetrics().getWapePct()).isGreaterThan((double) Long.MAX_VALUE);
    }

    @Test
    void evaluateNaive_forecastsLastActualSeededFromHistory() {
        MetricsResponse resp = service.evaluateNaive(BaselineRequest.builder()
            .startDate(LocalDate.of(2024, 1, 4))
            .backtestDays(2)
            .actuals(List.of(
                ActualPointDto.builder().date("2024-01-01").value(100.0).build(),
                ActualPointDto.builder().date("2024-01-02").value(80.0).build(),
                ActualPointDto.builder().date("2024-01-03").value(120.0).build(),
                ActualPointDto.builder().date("2024-01-04").value(500.0).build()))
            .build());

        assertThat(resp.getMethod()).isEqualTo(ForecastMetricsService.METHOD_NAIVE);
        assertThat(resp.getWindow().from()).isEqualTo(LocalDate.of(2024, 1, 2));
        assertThat(resp.getWindow().to()).isEqualTo(LocalDate.of(2024, 1, 3));
        assertThat(resp.getDailyErrors()).extracting(DailyError::getForecast).containsExactly(100.0, 80.0);
        assertThat(resp.getMetrics().getN()).isEqualTo(2);
        // |100-80| + |80-120| = 60 over 200
        assertThat(resp.getMetrics().getWapePct()).isEqualTo(30.0);
        assertThat(resp.getMetrics().getBiasPct()).isEqualTo(-10.0);
    }

    @Test
    void evaluateNaive_noHistory_seedsWithZero() {
        MetricsResponse resp = service.evaluateNaive(BaselineRequest.builder()
            .backtestDays(2)
            .actuals(List.of(
                ActualPointDto.builder().date("2024-01-01").value(40.0).build(),
                ActualPointDto.builder().date("2024-01-02").value(60.0).build()))
            .build());

        assertThat(resp.getDailyErrors()).extracting(DailyError::getForecast).containsExactly(0.0, 40.0);
        assertThat(resp.getMetrics().getWapePct()).isEqualTo(60.0);
    }
}
