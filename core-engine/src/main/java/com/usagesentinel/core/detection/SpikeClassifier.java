package com.usagesentinel.core.detection;

import com.usagesentinel.core.model.AnalyzedRecord;
import com.usagesentinel.core.model.UsageRecord;

import java.util.Objects;

/**
 * Flags single observations against a baseline.
 *
 * <p>
 * A quantity is a spike when it reaches {@value #SPIKE_RATIO} times the
 * baseline, boundary included. Stateless; every method requires a strictly
 * positive baseline, and callers are expected to treat a zero baseline as
 * "no alert possible" before reaching this class.
 * </p>
 *
 * @since 1.0.0
 */
public final class SpikeClassifier {

    /** Multiple of the baseline at which a day counts as a spike. */
    public static final double SPIKE_RATIO = 1.3;

    private SpikeClassifier() {
        // utility class, not instantiable
    }

    /**
     * @param baselineAverage positive baseline
     * @return {@code baselineAverage × 1.3}
     */
    public static double threshold(double baselineAverage) {
        requirePositive(baselineAverage);
        return baselineAverage * SPIKE_RATIO;
    }

    /**
     * @param quantity        observed quantity
     * @param baselineAverage positive baseline
     * @return {@code true} if {@code quantity >= baselineAverage × 1.3}
     */
    public static boolean isSpike(double quantity, double baselineAverage) {
        return quantity >= threshold(baselineAverage);
    }

    /**
     * @param quantity        observed quantity
     * @param baselineAverage positive baseline
     * @return signed percentage of {@code quantity} above the baseline
     */
    public static double percentAboveBaseline(double quantity, double baselineAverage) {
        requirePositive(baselineAverage);
        return (quantity - baselineAverage) / baselineAverage * 100;
    }

    /**
     * Annotate a record with its spike verdict.
     *
     * @param record          the record; must not be {@code null}
     * @param baselineAverage positive baseline
     * @return the annotated record
     */
    public static AnalyzedRecord classify(UsageRecord record, double baselineAverage) {
        Objects.requireNonNull(record, "record must not be null");
        double quantity = record.getQuantity();
        return new AnalyzedRecord(record,
                isSpike(quantity, baselineAverage),
                percentAboveBaseline(quantity, baselineAverage));
    }

    private static void requirePositive(double baselineAverage) {
        if (!(baselineAverage > 0) || Double.isInfinite(baselineAverage)) {
            throw new IllegalArgumentException(
                    "Baseline average must be a positive number, got: " + baselineAverage);
        }
    }
}
