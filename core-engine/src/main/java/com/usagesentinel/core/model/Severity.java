package com.usagesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert severity band.
 *
 * <p>
 * {@link #CRITICAL} when the increase over baseline is at least
 * {@value #CRITICAL_PERCENT}%, {@link #WARNING} otherwise. Only meaningful
 * once a spike has been established.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    CRITICAL,
    WARNING;

    /** Increase over baseline, in percent, from which a spike is critical. */
    public static final double CRITICAL_PERCENT = 50.0;

    /**
     * Classify a spike by its increase over baseline.
     *
     * @param percentageIncrease percent above baseline
     * @return {@link #CRITICAL} if {@code percentageIncrease >= 50}, else
     *         {@link #WARNING}
     */
    public static Severity fromPercentageIncrease(double percentageIncrease) {
        return percentageIncrease >= CRITICAL_PERCENT ? CRITICAL : WARNING;
    }

    /**
     * @return lowercase label used on the wire ("critical" / "warning")
     */
    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
