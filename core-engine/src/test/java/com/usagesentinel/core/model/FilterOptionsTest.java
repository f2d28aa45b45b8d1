package com.usagesentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for {@link FilterOptions}.
 */
class FilterOptionsTest {

    @Test
    @DisplayName("Should derive sorted, distinct regions, items and sub-regions")
    void shouldDeriveSortedOptions() {
        FilterOptions options = FilterOptions.from(List.of(
                new SeriesKey("South", "Coast", "Paracetamol"),
                new SeriesKey("North", "East", "ORS Packets"),
                new SeriesKey("North", "Central", "Paracetamol"),
                new SeriesKey("North", "Central", "Amoxicillin")));

        assertThat(options.getRegions()).containsExactly("North", "South");
        assertThat(options.getItems()).containsExactly("Amoxicillin", "ORS Packets", "Paracetamol");
        assertThat(options.getRegionSubRegions()).containsExactly(
                entry("North", List.of("Central", "East")),
                entry("South", List.of("Coast")));
    }

    @Test
    @DisplayName("Region without named sub-regions maps to an empty list")
    void shouldKeepRegionWithoutSubRegions() {
        FilterOptions options = FilterOptions.from(List.of(new SeriesKey("West", null, "Paracetamol")));

        assertThat(options.getRegionSubRegions()).containsEntry("West", List.of());
    }

    @Test
    @DisplayName("No keys yields empty options")
    void shouldHandleNoKeys() {
        FilterOptions options = FilterOptions.from(List.of());

        assertThat(options.getRegions()).isEmpty();
        assertThat(options.getItems()).isEmpty();
        assertThat(options.getRegionSubRegions()).isEmpty();
    }
}
