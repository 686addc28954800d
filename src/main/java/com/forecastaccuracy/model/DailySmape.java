package com.forecastaccuracy.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

public record DailySmape(@JsonFormat(pattern = "yyyy-MM-dd") LocalDate date, double smape) {}
