package com.forecastaccuracy.service;

import com.forecastaccuracy.dto.ActualPointDto;
import com.forecastaccuracy.dto.ForecastPointDto;
import com.forecastaccuracy.exception.SeriesTooLargeException;
import com.forecastaccuracy.model.TimePoint;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw request/upstream points into {@link TimePoint}s. Points without a
 * parseable date are dropped; non-finite numbers become absent values.
 */
@Component
public class SeriesPointMapper {

    @Value("${metrics.max-series-points:20000}")
    private int maxSeriesPoints;

    public List<TimePoint> toActuals(List<ActualPointDto> in) {
        checkSize("actuals", in);
        List<TimePoint> out = new ArrayList<>(in.size());
        for (ActualPointDto p : in) {
            LocalDate date = p != null ? parseDate(p.getDate()) : null;
            if (date == null) {
                continue;
            }
            Double value = p.getValue() != null ? p.getValue() : p.getActual();
            out.add(TimePoint.actual(date, value));
        }
        return out;
    }

    public List<TimePoint> toForecasts(List<ForecastPointDto> in) {
        checkSize("forecast", in);
        List<TimePoint> out = new ArrayList<>(in.size());
        for (ForecastPointDto p : in) {
            LocalDate date = p != null ? parseDate(p.getDate()) : null;
            if (date == null) {
                continue;
            }
            out.add(TimePoint.forecast(date, p.getForecast(), p.getP05(), p.getP95()));
        }
        return out;
    }

    /** Accepts {@code YYYY-MM-DD}, optionally followed by a time part. */
    static LocalDate parseDate(String raw) {
        if (raw == null || raw.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(raw.substring(0, 10));
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private void checkSize(String series, List<?> in) {
        if (in.size() > maxSeriesPoints) {
            throw new SeriesTooLargeException(series, in.size(), maxSeriesPoints);
        }
    }
}
