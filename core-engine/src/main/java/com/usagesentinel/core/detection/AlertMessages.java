package com.usagesentinel.core.detection;

import com.usagesentinel.core.model.SeriesKey;

import java.util.Locale;

/**
 * Sentence templates for alert messages. Percentages are rendered with one
 * decimal; whole quantities without a fractional part.
 */
final class AlertMessages {

    private AlertMessages() {
        // utility class, not instantiable
    }

    static String currentAlert(SeriesKey key, double percentageIncrease, double peakUsage) {
        return String.format(Locale.ROOT,
                "Abnormal %s consumption detected in %s. Usage is %.1f%% above baseline. Peak: %s units.",
                key.getItem(), key.location(), percentageIncrease, quantity(peakUsage));
    }

    static String fleetAlert(SeriesKey key, double percentageIncrease) {
        String where = key.getSubRegion() != null && !key.getSubRegion().isBlank()
                ? key.getSubRegion() + ", " + key.getRegion()
                : key.getRegion();
        return String.format(Locale.ROOT,
                "%s usage in %s is %.1f%% above normal levels.",
                key.getItem(), where, percentageIncrease);
    }

    static String quantity(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
