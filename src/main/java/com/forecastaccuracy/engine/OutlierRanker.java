package com.forecastaccuracy.engine;

import com.forecastaccuracy.model.DailyError;
import com.forecastaccuracy.model.OutlierScore;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Orders daily errors worst first: by {@link OutlierScore} value, then larger
 * absolute error, then earlier date. The order is total, so the result never
 * depends on input order.
 */
@Component
public class OutlierRanker {

    static final Comparator<DailyError> RANKING = Comparator
        .comparingDouble((DailyError d) -> OutlierScore.of(d).value()).reversed()
        .thenComparing(Comparator.comparingDouble(DailyError::getAbsError).reversed())
        .thenComparing(DailyError::getDate);

    public List<DailyError> rankOutliers(List<DailyError> dailyErrors, int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1, was " + topN);
        }
        return dailyErrors.stream()
            .sorted(RANKING)
            .limit(topN)
            .toList();
    }
}
