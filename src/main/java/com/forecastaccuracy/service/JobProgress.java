package com.forecastaccuracy.service;

/**
 * Lets a running job publish a stage message and percentage to its job record.
 */
@FunctionalInterface
public interface JobProgress {

    void report(String message, int percent);
}
