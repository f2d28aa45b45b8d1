package com.usagesentinel.core.model;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one monitored series: a (region, sub-region, item) triple.
 *
 * <p>
 * Keys order by region, then sub-region ({@code null} first), then item.
 * The fleet scanner uses that order as its final tie-breaker.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesKey implements Comparable<SeriesKey>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Comparator<SeriesKey> ORDER = Comparator
            .comparing(SeriesKey::getRegion)
            .thenComparing(SeriesKey::getSubRegion, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(SeriesKey::getItem);

    private final String region;
    private final String subRegion;
    private final String item;

    /**
     * @param region    region name; must not be {@code null}
     * @param subRegion sub-region name, or {@code null} for all sub-regions
     * @param item      item name; must not be {@code null}
     */
    public SeriesKey(String region, String subRegion, String item) {
        this.region = Objects.requireNonNull(region, "region must not be null");
        this.subRegion = subRegion;
        this.item = Objects.requireNonNull(item, "item must not be null");
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

    /**
     * @return the sub-region when present, otherwise the region
     */
    public String location() {
        return subRegion != null && !subRegion.isBlank() ? subRegion : region;
    }

    @Override
    public int compareTo(SeriesKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesKey that))
            return false;
        return region.equals(that.region)
                && Objects.equals(subRegion, that.subRegion)
                && item.equals(that.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, subRegion, item);
    }

    @Override
    public String toString() {
        return region + "/" + (subRegion != null ? subRegion : "*") + "/" + item;
    }
}
