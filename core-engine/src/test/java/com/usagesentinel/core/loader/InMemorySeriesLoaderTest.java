package com.usagesentinel.core.loader;

import com.usagesentinel.core.model.SeriesKey;
import com.usagesentinel.core.model.UsageRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemorySeriesLoader}.
 */
class InMemorySeriesLoaderTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 10);

    private InMemorySeriesLoader loader;

    @BeforeEach
    void setUp() {
        loader = new InMemorySeriesLoader(List.of(
                new UsageRecord("North", "Central", "Paracetamol", DAY.plusDays(1), 30),
                new UsageRecord("North", "Central", "Paracetamol", DAY, 10),
                new UsageRecord("North", "East", "Paracetamol", DAY, 5),
                new UsageRecord("North", "East", "ORS Packets", DAY, 7),
                new UsageRecord("South", "Coast", "Paracetamol", DAY, 12)));
    }

    @Test
    @DisplayName("Should load one sub-region ordered by date")
    void shouldLoadSubRegionInDateOrder() {
        List<UsageRecord> records = loader.load("North", "Central", "Paracetamol", DAY, DAY.plusDays(1));

        assertThat(records).extracting(UsageRecord::getQuantity).containsExactly(10.0, 30.0);
    }

    @Test
    @DisplayName("Should sum sub-regions per date when none is given")
    void shouldAggregateAcrossSubRegions() {
        List<UsageRecord> records = loader.load("North", null, "Paracetamol", DAY, DAY.plusDays(1));

        assertThat(records).extracting(UsageRecord::getQuantity).containsExactly(15.0, 30.0);
        assertThat(records).allSatisfy(r -> assertThat(r.getSubRegion()).isNull());
    }

    @Test
    @DisplayName("Exact-key load never merges sibling sub-regions")
    void shouldLoadExactKey() {
        loader.add(new UsageRecord("North", null, "Paracetamol", DAY, 100));

        assertThat(loader.loadKey(new SeriesKey("North", null, "Paracetamol"), DAY, DAY.plusDays(1)))
                .extracting(UsageRecord::getQuantity).containsExactly(100.0);
        assertThat(loader.loadKey(new SeriesKey("North", "Central", "Paracetamol"), DAY, DAY.plusDays(1)))
                .extracting(UsageRecord::getQuantity).containsExactly(10.0, 30.0);
        assertThat(loader.loadKey(new SeriesKey("North", "West", "Paracetamol"), DAY, DAY)).isEmpty();
    }

    @Test
    @DisplayName("Window bounds are inclusive")
    void shouldIncludeWindowBounds() {
        assertThat(loader.load("North", "Central", "Paracetamol", DAY, DAY)).hasSize(1);
        assertThat(loader.load("North", "Central", "Paracetamol", DAY.plusDays(2), DAY.plusDays(9))).isEmpty();
    }

    @Test
    @DisplayName("Adding a record for an existing day replaces it")
    void shouldReplaceSameDay() {
        loader.add(new UsageRecord("North", "Central", "Paracetamol", DAY, 99));

        assertThat(loader.load("North", "Central", "Paracetamol", DAY, DAY))
                .singleElement()
                .satisfies(r -> assertThat(r.getQuantity()).isEqualTo(99.0));
    }

    @Test
    @DisplayName("Should list distinct keys matching the filters")
    void shouldListKeys() {
        assertThat(loader.listKeys(null, null)).hasSize(4);
        assertThat(loader.listKeys("North", "Paracetamol")).containsExactlyInAnyOrder(
                new SeriesKey("North", "Central", "Paracetamol"),
                new SeriesKey("North", "East", "Paracetamol"));
        assertThat(loader.listKeys(null, "ORS Packets"))
                .containsExactly(new SeriesKey("North", "East", "ORS Packets"));
    }
}
