package com.usagesentinel.core.detection;

import java.util.List;
import java.util.Objects;

/**
 * Estimates the normal consumption level of a series.
 *
 * <p>
 * The baseline is the arithmetic mean of the first
 * {@code max(1, ceil(0.7 × n))} quantities of a date-ordered series. The
 * earlier 70% of the window is treated as history and the trailing 30% as
 * the evaluation period, so a sustained recent rise is measured against the
 * level that preceded it.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineEstimator {

    /** Share of the window, in tenths, used as history. */
    static final int HISTORY_TENTHS = 7;

    private BaselineEstimator() {
        // utility class, not instantiable
    }

    /**
     * Number of leading points that form the baseline for a series of
     * {@code n} points. Integer arithmetic keeps {@code ceil(0.7n)} exact.
     *
     * @param n series length; must be at least 1
     * @return {@code max(1, ceil(0.7 × n))}
     * @throws IllegalArgumentException if {@code n < 1}
     */
    public static int historyLength(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Series must contain at least one point, got: " + n);
        }
        return Math.max(1, (HISTORY_TENTHS * n + 9) / 10);
    }

    /**
     * Compute the baseline average.
     *
     * @param quantities quantities ordered by date ascending; not empty
     * @return mean of the leading history portion
     * @throws NullPointerException     if {@code quantities} is {@code null}
     * @throws IllegalArgumentException if {@code quantities} is empty
     */
    public static double estimate(List<Double> quantities) {
        Objects.requireNonNull(quantities, "quantities must not be null");
        int count = historyLength(quantities.size());
        double sum = 0;
        for (int i = 0; i < count; i++) {
            sum += quantities.get(i);
        }
        return sum / count;
    }
}
