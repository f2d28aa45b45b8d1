package com.usagesentinel.core.model;

import com.usagesentinel.core.exception.ErrorCode;
import com.usagesentinel.core.exception.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for {@link UsageRecord} and {@link SeriesKey}.
 */
class UsageRecordTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 10);

    @Test
    @DisplayName("Should reject a negative quantity")
    void shouldRejectNegativeQuantity() {
        InvalidInputException e = catchThrowableOfType(
                () -> new UsageRecord("North", null, "Paracetamol", DAY, -1), InvalidInputException.class);

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_QUANTITY);
        assertThat(e.getErrorCode().getCode()).isEqualTo("VAL_002");
    }

    @Test
    @DisplayName("Should reject a non-finite quantity")
    void shouldRejectNonFiniteQuantity() {
        assertThatThrownBy(() -> new UsageRecord("North", null, "Paracetamol", DAY, Double.NaN))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new UsageRecord("North", null, "Paracetamol", DAY, Double.POSITIVE_INFINITY))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Should reject blank region or item and a missing date")
    void shouldRejectMissingFields() {
        assertThatThrownBy(() -> new UsageRecord("", null, "Paracetamol", DAY, 1))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new UsageRecord("North", null, " ", DAY, 1))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new UsageRecord("North", null, "Paracetamol", null, 1))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("date");
    }

    @Test
    @DisplayName("Zero quantity is valid")
    void shouldAcceptZero() {
        assertThat(new UsageRecord("North", null, "Paracetamol", DAY, 0).getQuantity()).isZero();
    }

    @Test
    @DisplayName("Key carries region, sub-region and item")
    void shouldExposeKey() {
        SeriesKey key = new UsageRecord("North", "Central", "Paracetamol", DAY, 3).key();

        assertThat(key).isEqualTo(new SeriesKey("North", "Central", "Paracetamol"));
        assertThat(key.location()).isEqualTo("Central");
        assertThat(new SeriesKey("North", null, "Paracetamol").location()).isEqualTo("North");
    }

    @Test
    @DisplayName("Keys order by region, then sub-region with null first, then item")
    void shouldOrderKeys() {
        SeriesKey wholeRegion = new SeriesKey("North", null, "Paracetamol");
        SeriesKey central = new SeriesKey("North", "Central", "ORS Packets");
        SeriesKey south = new SeriesKey("South", null, "Amoxicillin");

        assertThat(wholeRegion).isLessThan(central);
        assertThat(central).isLessThan(south);
    }
}
