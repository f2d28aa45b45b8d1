package com.usagesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Alert describing the recent evaluation window of a single analysed series.
 *
 * <p>
 * At most one per analysis. Only created when at least one recent day is a
 * spike, so {@link #isSpike()} is always {@code true}.
 * </p>
 *
 * @since 1.0.0
 */
public final class CurrentAlert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Severity severity;
    private final String message;
    private final int affectedDays;
    private final double percentageIncrease;

    public CurrentAlert(Severity severity, String message, int affectedDays, double percentageIncrease) {
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.affectedDays = affectedDays;
        this.percentageIncrease = percentageIncrease;
    }

    @JsonProperty("isSpike")
    public boolean isSpike() {
        return true;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public int getAffectedDays() {
        return affectedDays;
    }

    public double getPercentageIncrease() {
        return percentageIncrease;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CurrentAlert that))
            return false;
        return affectedDays == that.affectedDays
                && Double.compare(percentageIncrease, that.percentageIncrease) == 0
                && severity == that.severity
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, message, affectedDays, percentageIncrease);
    }

    @Override
    public String toString() {
        return "CurrentAlert{" +
                "severity=" + severity +
                ", affectedDays=" + affectedDays +
                ", percentageIncrease=" + percentageIncrease +
                ", message='" + message + '\'' +
                '}';
    }
}
