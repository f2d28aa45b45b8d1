package com.usagesentinel.core.loader;

import com.usagesentinel.core.model.SeriesKey;
import com.usagesentinel.core.model.UsageRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link SeriesLoader} backed by a list held in memory.
 *
 * <p>
 * Used for fixtures and small embedded data sets. Adding a record with the
 * same (region, sub-region, item, date) as an existing one replaces it.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemorySeriesLoader implements SeriesLoader {

    private final List<UsageRecord> records = new CopyOnWriteArrayList<>();

    public InMemorySeriesLoader() {
    }

    public InMemorySeriesLoader(Collection<UsageRecord> initial) {
        Objects.requireNonNull(initial, "initial records must not be null");
        initial.forEach(this::add);
    }

    /**
     * Add or replace a record.
     *
     * @param record the record; must not be {@code null}
     * @return this loader, for chaining
     */
    public synchronized InMemorySeriesLoader add(UsageRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        records.removeIf(r -> r.key().equals(record.key()) && r.getDate().equals(record.getDate()));
        records.add(record);
        return this;
    }

    @Override
    public List<UsageRecord> load(String region, String subRegion, String item,
            LocalDate startDate, LocalDate endDate) {
        Objects.requireNonNull(region, "region must not be null");
        Objects.requireNonNull(item, "item must not be null");
        Objects.requireNonNull(startDate, "startDate must not be null");
        Objects.requireNonNull(endDate, "endDate must not be null");

        List<UsageRecord> matching = records.stream()
                .filter(r -> r.getRegion().equals(region) && r.getItem().equals(item))
                .filter(r -> subRegion == null || subRegion.equals(r.getSubRegion()))
                .filter(r -> !r.getDate().isBefore(startDate) && !r.getDate().isAfter(endDate))
                .sorted(Comparator.comparing(UsageRecord::getDate))
                .toList();

        if (subRegion != null) {
            return matching;
        }

        // Sum across sub-regions so each date appears once
        Map<LocalDate, Double> perDay = new TreeMap<>();
        for (UsageRecord r : matching) {
            perDay.merge(r.getDate(), r.getQuantity(), Double::sum);
        }
        List<UsageRecord> aggregated = new ArrayList<>(perDay.size());
        perDay.forEach((date, qty) -> aggregated.add(new UsageRecord(region, null, item, date, qty)));
        return aggregated;
    }

    @Override
    public List<UsageRecord> loadKey(SeriesKey key, LocalDate startDate, LocalDate endDate) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(startDate, "startDate must not be null");
        Objects.requireNonNull(endDate, "endDate must not be null");

        return records.stream()
                .filter(r -> r.key().equals(key))
                .filter(r -> !r.getDate().isBefore(startDate) && !r.getDate().isAfter(endDate))
                .sorted(Comparator.comparing(UsageRecord::getDate))
                .toList();
    }

    @Override
    public List<SeriesKey> listKeys(String regionFilter, String itemFilter) {
        Set<SeriesKey> keys = new LinkedHashSet<>();
        for (UsageRecord r : records) {
            if (regionFilter != null && !regionFilter.equals(r.getRegion())) {
                continue;
            }
            if (itemFilter != null && !itemFilter.equals(r.getItem())) {
                continue;
            }
            keys.add(r.key());
        }
        return List.copyOf(keys);
    }
}
