package com.forecastaccuracy.service;

import com.forecastaccuracy.dto.ActualPointDto;
import com.forecastaccuracy.dto.ForecastPointDto;
import com.forecastaccuracy.exception.SeriesTooLargeException;
import com.forecastaccuracy.model.TimePoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeriesPointMapperTest {

    private final SeriesPointMapper mapper = new SeriesPointMapper();

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(mapper, "maxSeriesPoints", 10);
    }

    @Test
    void toActuals_dropsPointsWithUnparseableDates() {
        List<TimePoint> out = mapper.toActuals(List.of(
            ActualPointDto.builder().date("2024-01-01T00:00:00").value(5.0).build(),
            ActualPointDto.builder().date("01/02/2024").value(6.0).build(),
            ActualPointDto.builder().date(null).value(7.0).build(),
            ActualPointDto.builder().date("2024-02-30").value(8.0).build()));

        assertThat(out).extracting(TimePoint::getDate).containsExactly(LocalDate.of(2024, 1, 1));
    }

    @Test
    void toActuals_fallsBackToActualFieldAndKeepsMissingValues() {
        List<TimePoint> out = mapper.toActuals(List.of(
            ActualPointDto.builder().date("2024-01-01").actual(42.0).build(),
            ActualPointDto.builder().date("2024-01-02").value(Double.NaN).build()));

        assertThat(out.get(0).getActual()).isEqualTo(42.0);
        assertThat(out.get(1).getActual()).isNull();
        assertThat(out.get(1).hasActual()).isFalse();
    }

    @Test
    void toForecasts_nonFiniteBandBecomesAbsent() {
        List<TimePoint> out = mapper.toForecasts(List.of(
            ForecastPointDto.builder().date("2024-01-01").forecast(10.0)
                .p05(Double.NEGATIVE_INFINITY).p95(12.0).build()));

        assertThat(out.get(0).getForecast()).isEqualTo(10.0);
        assertThat(out.get(0).getP05()).isNull();
        assertThat(out.get(0).getP95()).isEqualTo(12.0);
    }

    @Test
    void toForecasts_overLimit_throws() {
        List<ForecastPointDto> tooMany = Collections.nCopies(11,
            ForecastPointDto.builder().date("2024-01-01").forecast(1.0).build());

        assertThatThrownBy(() -> mapper.toForecasts(tooMany))
            .isInstanceOf(SeriesTooLargeException.class);
    }
}
