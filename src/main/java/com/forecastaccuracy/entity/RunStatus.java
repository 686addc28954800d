package com.forecastaccuracy.entity;

public enum RunStatus {
    QUEUED,
    RUNNING,
    SUCCESS,
    FAILED
}
