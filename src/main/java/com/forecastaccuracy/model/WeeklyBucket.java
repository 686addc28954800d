package com.forecastaccuracy.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Sums of one ISO week. A null sum means no contributing day was seen for that
 * field, which is different from a sum of zero.
 */
@Value
@Builder(toBuilder = true)
public class WeeklyBucket {
    String weekKey;
    LocalDate firstDate;
    Double actualSum;
    Double forecastSum;
    Double p05Sum;
    Double p95Sum;
}
