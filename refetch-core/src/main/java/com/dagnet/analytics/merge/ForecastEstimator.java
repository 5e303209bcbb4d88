package com.dagnet.analytics.merge;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Baseline conversion probability from settled days only, weighting recent days more.
 *
 * <p>A day is settled once it is at least {@code maturityDays + 1} days old. Each settled day
 * contributes with weight {@code exp(-age / halfLife)}; the estimate is
 * {@code sum(w*k) / sum(w*n)}.</p>
 */
public final class ForecastEstimator {
    private ForecastEstimator() {}

    /**
     * @return the estimate, or null when no settled day with a positive n remains
     */
    public static Double estimate(
            List<LocalDate> dates,
            List<Integer> nDaily,
            List<Integer> kDaily,
            int maturityDays,
            LocalDate today,
            double halfLifeDays) {
        if (!(halfLifeDays > 0.0)) {
            throw new IllegalArgumentException("halfLifeDays must be > 0");
        }
        double weightedN = 0.0;
        double weightedK = 0.0;
        boolean anySettled = false;
        for (int i = 0; i < dates.size(); i++) {
            long age = ChronoUnit.DAYS.between(dates.get(i), today);
            if (age < maturityDays + 1L) {
                continue;
            }
            double weight = Math.exp(-age / halfLifeDays);
            weightedN += weight * nDaily.get(i);
            weightedK += weight * kDaily.get(i);
            anySettled = true;
        }
        if (!anySettled || weightedN <= 0.0) {
            return null;
        }
        return weightedK / weightedN;
    }
}
