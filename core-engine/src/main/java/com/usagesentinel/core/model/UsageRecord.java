package com.usagesentinel.core.model;

import com.usagesentinel.core.exception.ErrorCode;
import com.usagesentinel.core.exception.InvalidInputException;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One day of consumption for one (region, sub-region, item) series.
 *
 * <p>
 * Immutable once constructed. A {@code null} sub-region marks a record that
 * aggregates every sub-region of its region for that day.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * Construction fails with {@link InvalidInputException} when region or item
 * is blank, the date is missing, or the quantity is negative or not a finite
 * number.
 * </p>
 *
 * @since 1.0.0
 */
public final class UsageRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String region;
    private final String subRegion;
    private final String item;
    private final LocalDate date;
    private final double quantity;

    public UsageRecord(String region, String subRegion, String item, LocalDate date, double quantity) {
        this.region = requireNonBlank(region, "region");
        this.subRegion = subRegion;
        this.item = requireNonBlank(item, "item");
        if (date == null) {
            throw new InvalidInputException("Usage record date is required");
        }
        this.date = date;
        if (Double.isNaN(quantity) || Double.isInfinite(quantity) || quantity < 0) {
            throw new InvalidInputException(
                    "Quantity must be a non-negative number, got: " + quantity
                            + " for " + item + " in " + region + " on " + date,
                    ErrorCode.INVALID_QUANTITY);
        }
        this.quantity = quantity;
    }

    /**
     * @return the series this record belongs to
     */
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

    public LocalDate getDate() {
        return date;
    }

    public double getQuantity() {
        return quantity;
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException("Usage record " + name + " is required");
        }
        return value;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof UsageRecord that))
            return false;
        return Double.compare(quantity, that.quantity) == 0
                && region.equals(that.region)
                && Objects.equals(subRegion, that.subRegion)
                && item.equals(that.item)
                && date.equals(that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, subRegion, item, date, quantity);
    }

    @Override
    public String toString() {
        return "UsageRecord{" +
                "region='" + region + '\'' +
                ", subRegion='" + subRegion + '\'' +
                ", item='" + item + '\'' +
                ", date=" + date +
                ", quantity=" + quantity +
                '}';
    }
}
