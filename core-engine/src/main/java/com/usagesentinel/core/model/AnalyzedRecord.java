package com.usagesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A {@link UsageRecord} annotated with its spike verdict.
 *
 * <p>
 * Computed on every analysis and never persisted. {@code percentAboveBaseline}
 * is signed: negative when the day sits below baseline.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalyzedRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final UsageRecord record;
    private final boolean spike;
    private final double percentAboveBaseline;

    public AnalyzedRecord(UsageRecord record, boolean spike, double percentAboveBaseline) {
        this.record = Objects.requireNonNull(record, "record must not be null");
        this.spike = spike;
        this.percentAboveBaseline = percentAboveBaseline;
    }

    public String getRegion() {
        return record.getRegion();
    }

    public String getSubRegion() {
        return record.getSubRegion();
    }

    public String getItem() {
        return record.getItem();
    }

    public LocalDate getDate() {
        return record.getDate();
    }

    public double getQuantity() {
        return record.getQuantity();
    }

    @JsonProperty("isSpike")
    public boolean isSpike() {
        return spike;
    }

    public double getPercentAboveBaseline() {
        return percentAboveBaseline;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalyzedRecord that))
            return false;
        return spike == that.spike
                && Double.compare(percentAboveBaseline, that.percentAboveBaseline) == 0
                && record.equals(that.record);
    }

    @Override
    public int hashCode() {
        return Objects.hash(record, spike, percentAboveBaseline);
    }

    @Override
    public String toString() {
        return "AnalyzedRecord{" +
                "date=" + record.getDate() +
                ", quantity=" + record.getQuantity() +
                ", spike=" + spike +
                ", percentAboveBaseline=" + percentAboveBaseline +
                '}';
    }
}
