package com.forecastaccuracy.engine;

import com.forecastaccuracy.model.BacktestWindow;
import com.forecastaccuracy.model.DailyError;
import com.forecastaccuracy.model.DailySmape;
import com.forecastaccuracy.model.MetricsSummary;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AggregateMetricsComputerTest {

    private static final LocalDate D1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate D2 = LocalDate.of(2024, 1, 2);
    private static final BacktestWindow WINDOW = BacktestWindow.endingOn(D2, 2);

    private final AggregateMetricsComputer computer = new AggregateMetricsComputer();

    private static List<DailyError> twoDayScenario() {
        return List.of(DailyError.of(D1, 0.0, 50.0, 5.0), DailyError.of(D2, 500.0, 480.0, 5.0));
    }

    @Test
    void computeSummary_twoDayScenario() {
        MetricsSummary s = computer.computeSummary(twoDayScenario(), WINDOW, 5.0);

        assertThat(s.getN()).isEqualTo(2);
        assertThat(s.getNonzeroActualDays()).isEqualTo(1);
        assertThat(s.getZeroActualDays()).isEqualTo(1);
        assertThat(s.getApeDenominatorFloor()).isEqualTo(5.0);
        assertThat(s.getMapePct()).isCloseTo(4.0, within(1e-9));
        assertThat(s.getWapePct()).isCloseTo(14.0, within(1e-9));
        assertThat(s.getBiasPct()).isCloseTo(6.0, within(1e-9));
        // day1: 2*50/50 = 2.0, day2: 2*20/980
        assertThat(s.getSmapePct()).isCloseTo(100.0 * (2.0 + 40.0 / 980.0) / 2, within(1e-9));
    }

    @Test
    void computeSummary_emptyWindow_returnsNullMetrics() {
        MetricsSummary s = computer.computeSummary(List.of(), WINDOW, 1.0);

        assertThat(s.getN()).isZero();
        assertThat(s.getMapePct()).isNull();
        assertThat(s.getSmapePct()).isNull();
        assertThat(s.getWapePct()).isNull();
        assertThat(s.getBiasPct()).isNull();
        assertThat(s.getWindow()).isEqualTo(WINDOW);
    }

    @Test
    void computeSummary_zeroActualSum_nullsOnlyWapeAndBias() {
        List<DailyError> errors = List.of(DailyError.of(D1, 0.0, 10.0, 1.0), DailyError.of(D2, 0.0, 0.0, 1.0));
        MetricsSummary s = computer.computeSummary(errors, WINDOW, 1.0);

        assertThat(s.getWapePct()).isNull();
        assertThat(s.getBiasPct()).isNull();
        assertThat(s.getMapePct()).isNull();
        // only day1 has a defined sMAPE term
        assertThat(s.getSmapePct()).isCloseTo(200.0, within(1e-9));
        assertThat(s.getZeroActualDays()).isEqualTo(2);
    }

    @Test
    void computeSummary_isIndependentOfRecordOrder() {
        List<DailyError> errors = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            errors.add(DailyError.of(D1.plusDays(i), 100.0 + i * 7, 90.0 + i * 11, 1.0));
        }
        MetricsSummary ordered = computer.computeSummary(errors, WINDOW, 1.0);

        Collections.shuffle(errors, new Random(42));
        MetricsSummary shuffled = computer.computeSummary(errors, WINDOW, 1.0);

        assertThat(shuffled.getWapePct()).isCloseTo(ordered.getWapePct(), within(1e-9));
        assertThat(shuffled.getBiasPct()).isCloseTo(ordered.getBiasPct(), within(1e-9));
        assertThat(shuffled.getMapePct()).isCloseTo(ordered.getMapePct(), within(1e-9));
    }

    @Test
    void dailySmape_omitsDaysWithZeroDenominator() {
        List<DailyError> errors = List.of(
            DailyError.of(D1, 0.0, 0.0, 1.0),
            DailyError.of(D2, 100.0, 50.0, 1.0));

        List<DailySmape> points = computer.dailySmape(errors);

        assertThat(points).hasSize(1);
        assertThat(points.get(0).date()).isEqualTo(D2);
        assertThat(points.get(0).smape()).isCloseTo(100.0 / 150.0, within(1e-12));
    }
}
