package com.usagesentinel.core.model;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Distinct regions, items and per-region sub-regions known to the data
 * source, each sorted ascending.
 *
 * @since 1.0.0
 */
public final class FilterOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> regions;
    private final List<String> items;
    private final Map<String, List<String>> regionSubRegions;

    private FilterOptions(List<String> regions, List<String> items,
            Map<String, List<String>> regionSubRegions) {
        this.regions = regions;
        this.items = items;
        this.regionSubRegions = regionSubRegions;
    }

    /**
     * Derive filter options from a set of series keys.
     *
     * @param keys series keys; must not be {@code null}
     * @return sorted filter options
     */
    public static FilterOptions from(Collection<SeriesKey> keys) {
        Objects.requireNonNull(keys, "keys must not be null");
        TreeSet<String> regions = new TreeSet<>();
        TreeSet<String> items = new TreeSet<>();
        TreeMap<String, TreeSet<String>> subRegions = new TreeMap<>();

        for (SeriesKey key : keys) {
            regions.add(key.getRegion());
            items.add(key.getItem());
            TreeSet<String> subs = subRegions.computeIfAbsent(key.getRegion(), r -> new TreeSet<>());
            if (key.getSubRegion() != null) {
                subs.add(key.getSubRegion());
            }
        }

        Map<String, List<String>> regionSubRegions = new LinkedHashMap<>();
        subRegions.forEach((region, subs) -> regionSubRegions.put(region, List.copyOf(subs)));

        return new FilterOptions(
                List.copyOf(regions),
                List.copyOf(items),
                Collections.unmodifiableMap(regionSubRegions));
    }

    public List<String> getRegions() {
        return regions;
    }

    public List<String> getItems() {
        return items;
    }

    public Map<String, List<String>> getRegionSubRegions() {
        return regionSubRegions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FilterOptions that))
            return false;
        return regions.equals(that.regions)
                && items.equals(that.items)
                && regionSubRegions.equals(that.regionSubRegions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regions, items, regionSubRegions);
    }

    @Override
    public String toString() {
        return "FilterOptions{regions=" + regions + ", items=" + items + '}';
    }
}
