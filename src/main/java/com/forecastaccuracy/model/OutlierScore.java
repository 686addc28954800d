package com.forecastaccuracy.model;

/**
 * Ranking score of a daily error: its APE when defined, otherwise its absolute error.
 * The two kinds are not on the same scale; they are still compared by raw value,
 * so a large absolute error on a below-floor day outranks any ratio.
 */
public record OutlierScore(Kind kind, double value) {

    public enum Kind { APE, ABS_ERROR }

    public static OutlierScore of(DailyError error) {
        return error.getApe() != null
            ? new OutlierScore(Kind.APE, error.getApe())
            : new OutlierScore(Kind.ABS_ERROR, error.getAbsError());
    }
}
