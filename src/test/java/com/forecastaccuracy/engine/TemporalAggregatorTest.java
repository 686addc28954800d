package com.forecastaccuracy.engine;

import com.forecastaccuracy.model.TimePoint;
import com.forecastaccuracy.model.WeeklyBucket;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TemporalAggregatorTest {

    private final TemporalAggregator aggregator = new TemporalAggregator();

    @Test
    void bucketToWeeks_missingDayIsNotCountedAsZero() {
        LocalDate monday = LocalDate.of(2024, 3, 4);
        List<WeeklyBucket> weeks = aggregator.bucketToWeeks(List.of(
            TimePoint.actual(monday, 100.0),
            TimePoint.actual(monday.plusDays(1), null),
            TimePoint.actual(monday.plusDays(2), 200.0)));

        assertThat(weeks).hasSize(1);
        WeeklyBucket week = weeks.get(0);
        assertThat(week.getWeekKey()).isEqualTo("2024-W10");
        assertThat(week.getActualSum()).isEqualTo(300.0);
        assertThat(week.getForecastSum()).isNull();
        assertThat(week.getP05Sum()).isNull();
    }

    @Test
    void bucketToWeeks_sortedByWeekWithEarliestDateAsAnchor() {
        List<WeeklyBucket> weeks = aggregator.bucketToWeeks(List.of(
            TimePoint.forecast(LocalDate.of(2024, 3, 14), 10.0, null, null),
            TimePoint.forecast(LocalDate.of(2024, 3, 6), 20.0, null, null),
            TimePoint.forecast(LocalDate.of(2024, 3, 5), 30.0, null, null)));

        assertThat(weeks).extracting(WeeklyBucket::getWeekKey).containsExactly("2024-W10", "2024-W11");
        assertThat(weeks.get(0).getFirstDate()).isEqualTo(LocalDate.of(2024, 3, 5));
        assertThat(weeks.get(0).getForecastSum()).isEqualTo(50.0);
    }

    @Test
    void bucketToWeeks_negativeValuesFlooredAtZero() {
        LocalDate day = LocalDate.of(2024, 3, 4);
        List<WeeklyBucket> weeks = aggregator.bucketToWeeks(List.of(
            TimePoint.actual(day, -50.0),
            TimePoint.actual(day.plusDays(1), 80.0)));

        assertThat(weeks.get(0).getActualSum()).isEqualTo(80.0);
    }

    @Test
    void bucketToWeeks_weekWithoutValuesIsNotCreated() {
        List<WeeklyBucket> weeks = aggregator.bucketToWeeks(List.of(
            TimePoint.actual(LocalDate.of(2024, 3, 4), null),
            TimePoint.actual(LocalDate.of(2024, 3, 11), 5.0)));

        assertThat(weeks).extracting(WeeklyBucket::getWeekKey).containsExactly("2024-W11");
    }

    @Test
    void isoWeekKey_usesWeekBasedYear() {
        assertThat(TemporalAggregator.isoWeekKey(LocalDate.of(2021, 1, 3))).isEqualTo("2020-W53");
        assertThat(TemporalAggregator.isoWeekKey(LocalDate.of(2024, 12, 30))).isEqualTo("2025-W01");
        assertThat(TemporalAggregator.isoWeekKey(LocalDate.of(2024, 1, 1))).isEqualTo("2024-W01");
    }
}
