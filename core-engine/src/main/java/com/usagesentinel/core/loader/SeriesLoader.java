package com.usagesentinel.core.loader;

import com.usagesentinel.core.exception.DataAccessException;
import com.usagesentinel.core.model.SeriesKey;
import com.usagesentinel.core.model.UsageRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Data source for usage series.
 *
 * <p>
 * Implementations must be safe to call from several threads at once: the
 * fleet scanner issues one {@link #load} per key from a worker pool.
 * </p>
 */
public interface SeriesLoader {

    /**
     * Load one series over an inclusive date window.
     *
     * <p>
     * When {@code subRegion} is {@code null} the loader returns one record
     * per date holding the sum over every sub-region of the region, with a
     * {@code null} sub-region.
     * </p>
     *
     * @param region    region name; required
     * @param subRegion sub-region name, or {@code null} for all sub-regions
     * @param item      item name; required
     * @param startDate first date of the window, inclusive
     * @param endDate   last date of the window, inclusive
     * @return records ordered by date ascending; empty if none
     * @throws DataAccessException if the backing store cannot be read
     */
    List<UsageRecord> load(String region, String subRegion, String item,
            LocalDate startDate, LocalDate endDate);

    /**
     * Load exactly the records stored under one key, with no aggregation.
     *
     * <p>
     * A key with a {@code null} sub-region selects only the records stored
     * without a sub-region, never those of its sibling sub-regions. Every
     * key returned by {@link #listKeys} round-trips through this method.
     * </p>
     *
     * @param key       the series; must not be {@code null}
     * @param startDate first date of the window, inclusive
     * @param endDate   last date of the window, inclusive
     * @return records ordered by date ascending; empty if none
     * @throws DataAccessException if the backing store cannot be read
     */
    List<UsageRecord> loadKey(SeriesKey key, LocalDate startDate, LocalDate endDate);

    /**
     * List the distinct series keys present in the data source.
     *
     * @param regionFilter only keys in this region, or {@code null} for all
     * @param itemFilter   only keys for this item, or {@code null} for all
     * @return distinct keys, in no particular order
     * @throws DataAccessException if the backing store cannot be read
     */
    List<SeriesKey> listKeys(String regionFilter, String itemFilter);
}
