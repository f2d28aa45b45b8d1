package com.usagesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of analysing one series over a window.
 *
 * <p>
 * When the window holds no data, or the baseline is degenerate, both
 * {@code stats} and {@code alert} are {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesAnalysis implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final SeriesAnalysis EMPTY = new SeriesAnalysis(List.of(), null, null);

    private final List<AnalyzedRecord> records;
    private final SeriesStats stats;
    private final CurrentAlert alert;

    public SeriesAnalysis(List<AnalyzedRecord> records, SeriesStats stats, CurrentAlert alert) {
        Objects.requireNonNull(records, "records must not be null");
        this.records = List.copyOf(records);
        this.stats = stats;
        this.alert = alert;
    }

    /**
     * @return the shared result for a window without data
     */
    public static SeriesAnalysis empty() {
        return EMPTY;
    }

    /**
     * @return unmodifiable list of annotated records, ordered by date
     */
    @JsonProperty("usage")
    public List<AnalyzedRecord> getRecords() {
        return records;
    }

    public SeriesStats getStats() {
        return stats;
    }

    public CurrentAlert getAlert() {
        return alert;
    }

    public Optional<CurrentAlert> alert() {
        return Optional.ofNullable(alert);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesAnalysis that))
            return false;
        return records.equals(that.records)
                && Objects.equals(stats, that.stats)
                && Objects.equals(alert, that.alert);
    }

    @Override
    public int hashCode() {
        return Objects.hash(records, stats, alert);
    }

    @Override
    public String toString() {
        return "SeriesAnalysis{records=" + records.size() + ", stats=" + stats + ", alert=" + alert + '}';
    }
}
