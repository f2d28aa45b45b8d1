package com.usagesentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Summary statistics for one analysed window.
 *
 * <p>
 * Recomputed on every call; never cached. {@code spikeThreshold} is always
 * {@code baselineAverage × 1.3}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double totalUsage;
    private final double averageUsage;
    private final double baselineAverage;
    private final double spikeThreshold;
    private final double minUsage;
    private final double maxUsage;
    private final int dataPoints;

    public SeriesStats(double totalUsage, double averageUsage, double baselineAverage,
            double spikeThreshold, double minUsage, double maxUsage, int dataPoints) {
        this.totalUsage = totalUsage;
        this.averageUsage = averageUsage;
        this.baselineAverage = baselineAverage;
        this.spikeThreshold = spikeThreshold;
        this.minUsage = minUsage;
        this.maxUsage = maxUsage;
        this.dataPoints = dataPoints;
    }

    public double getTotalUsage() {
        return totalUsage;
    }

    public double getAverageUsage() {
        return averageUsage;
    }

    public double getBaselineAverage() {
        return baselineAverage;
    }

    public double getSpikeThreshold() {
        return spikeThreshold;
    }

    public double getMinUsage() {
        return minUsage;
    }

    public double getMaxUsage() {
        return maxUsage;
    }

    public int getDataPoints() {
        return dataPoints;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesStats that))
            return false;
        return Double.compare(totalUsage, that.totalUsage) == 0
                && Double.compare(averageUsage, that.averageUsage) == 0
                && Double.compare(baselineAverage, that.baselineAverage) == 0
                && Double.compare(spikeThreshold, that.spikeThreshold) == 0
                && Double.compare(minUsage, that.minUsage) == 0
                && Double.compare(maxUsage, that.maxUsage) == 0
                && dataPoints == that.dataPoints;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalUsage, averageUsage, baselineAverage, spikeThreshold,
                minUsage, maxUsage, dataPoints);
    }

    @Override
    public String toString() {
        return "SeriesStats{" +
                "totalUsage=" + totalUsage +
                ", averageUsage=" + averageUsage +
                ", baselineAverage=" + baselineAverage +
                ", spikeThreshold=" + spikeThreshold +
                ", minUsage=" + minUsage +
                ", maxUsage=" + maxUsage +
                ", dataPoints=" + dataPoints +
                '}';
    }
}
