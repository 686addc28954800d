package com.forecastaccuracy.entity;

public enum SeriesKind {
    ACTUAL,
    FORECAST
}
