package com.forecastaccuracy.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class WeeklySeriesResponse {
    List<WeeklyPoint> weeks;
    List<StaffingRow> staffing;
    double savingsTotal;
    boolean hasQuantiles;

    @Value
    @Builder
    public static class WeeklyPoint {
        String week;
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate iso;
        Double actual;
        Double forecast;
        Double p05;
        Double p95;
        Double opportunities;
    }

    @Value
    @Builder
    public static class StaffingRow {
        String week;
        double forecastKg;
        double fteNeeded;
        double utilizationPct;
        double baseFte;
        double savings;
    }
}
