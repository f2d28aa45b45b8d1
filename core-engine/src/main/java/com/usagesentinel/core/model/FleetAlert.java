package com.usagesentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Alert raised by a fleet scan for one series with an active spike.
 *
 * <p>
 * {@code peakUsage} is the largest quantity among the spiking days of the
 * recent window, and {@code percentageIncrease} is measured from that peak.
 * {@code detectedAt} is the date of the latest spiking day.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Region, item, severity, message and detection
 * date are required; omitting any of them throws
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class FleetAlert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String region;
    private final String subRegion;
    private final String item;
    private final double percentageIncrease;
    private final Severity severity;
    private final String message;
    private final double peakUsage;
    private final double baselineAvg;
    private final LocalDate detectedAt;

    private FleetAlert(Builder builder) {
        this.region = Objects.requireNonNull(builder.region, "region must not be null");
        this.subRegion = builder.subRegion;
        this.item = Objects.requireNonNull(builder.item, "item must not be null");
        this.percentageIncrease = builder.percentageIncrease;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.message = Objects.requireNonNull(builder.message, "message must not be null");
        this.peakUsage = builder.peakUsage;
        this.baselineAvg = builder.baselineAvg;
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link FleetAlert} instances.
     */
    public static class Builder {
        private String region;
        private String subRegion;
        private String item;
        private double percentageIncrease;
        private Severity severity;
        private String message;
        private double peakUsage;
        private double baselineAvg;
        private LocalDate detectedAt;

        public Builder key(SeriesKey key) {
            this.region = key.getRegion();
            this.subRegion = key.getSubRegion();
            this.item = key.getItem();
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder subRegion(String subRegion) {
            this.subRegion = subRegion;
            return this;
        }

        public Builder item(String item) {
            this.item = item;
            return this;
        }

        public Builder percentageIncrease(double percentageIncrease) {
            this.percentageIncrease = percentageIncrease;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder peakUsage(double peakUsage) {
            this.peakUsage = peakUsage;
            return this;
        }

        public Builder baselineAvg(double baselineAvg) {
            this.baselineAvg = baselineAvg;
            return this;
        }

        public Builder detectedAt(LocalDate detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public FleetAlert build() {
            return new FleetAlert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public SeriesKey key() {
        return new SeriesKey(region, subRegion, item);
    }

    public String getRegion() {
        return region;
    }

    public String getSubRegion() {
        return subRegion;
    }

    public String getItem() {
        return item;
    }

    public double getPercentageIncrease() {
        return percentageIncrease;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public double getPeakUsage() {
        return peakUsage;
    }

    public double getBaselineAvg() {
        return baselineAvg;
    }

    public LocalDate getDetectedAt() {
        return detectedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FleetAlert that))
            return false;
        return Double.compare(percentageIncrease, that.percentageIncrease) == 0
                && Double.compare(peakUsage, that.peakUsage) == 0
                && Double.compare(baselineAvg, that.baselineAvg) == 0
                && region.equals(that.region)
                && Objects.equals(subRegion, that.subRegion)
                && item.equals(that.item)
                && severity == that.severity
                && detectedAt.equals(that.detectedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, subRegion, item, percentageIncrease, severity, peakUsage,
                baselineAvg, detectedAt);
    }

    @Override
    public String toString() {
        return "FleetAlert{" +
                "region='" + region + '\'' +
                ", subRegion='" + subRegion + '\'' +
                ", item='" + item + '\'' +
                ", severity=" + severity +
                ", percentageIncrease=" + percentageIncrease +
                ", peakUsage=" + peakUsage +
                ", baselineAvg=" + baselineAvg +
                ", detectedAt=" + detectedAt +
                '}';
    }
}
