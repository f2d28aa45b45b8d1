package com.usagesentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BaselineEstimator}.
 */
class BaselineEstimatorTest {

    @Test
    @DisplayName("History length is the ceiling of 70% of the series")
    void shouldUseCeilingOfSeventyPercent() {
        assertThat(BaselineEstimator.historyLength(1)).isEqualTo(1);
        assertThat(BaselineEstimator.historyLength(2)).isEqualTo(2);
        assertThat(BaselineEstimator.historyLength(3)).isEqualTo(3);
        assertThat(BaselineEstimator.historyLength(7)).isEqualTo(5);
        assertThat(BaselineEstimator.historyLength(10)).isEqualTo(7);
        assertThat(BaselineEstimator.historyLength(11)).isEqualTo(8);
        assertThat(BaselineEstimator.historyLength(30)).isEqualTo(21);
        assertThat(BaselineEstimator.historyLength(31)).isEqualTo(22);
    }

    @Test
    @DisplayName("Baseline ignores the trailing evaluation period")
    void shouldAverageLeadingPortionOnly() {
        List<Double> series = List.of(100.0, 100.0, 100.0, 100.0, 100.0, 100.0, 200.0);
        assertThat(BaselineEstimator.estimate(series)).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Baseline of a mixed history is its arithmetic mean")
    void shouldComputeMeanOfHistory() {
        // n=10 -> first 7 points
        List<Double> series = List.of(10.0, 20.0, 30.0, 40.0, 50.0, 60.0, 70.0, 500.0, 500.0, 500.0);
        assertThat(BaselineEstimator.estimate(series)).isCloseTo(40.0, within(1e-9));
    }

    @Test
    @DisplayName("Single point is its own baseline")
    void shouldUseOnlyPointForSingleton() {
        assertThat(BaselineEstimator.estimate(List.of(50.0))).isEqualTo(50.0);
    }

    @Test
    @DisplayName("All-zero history yields a zero baseline")
    void shouldReturnZeroForZeroHistory() {
        assertThat(BaselineEstimator.estimate(Collections.nCopies(10, 0.0))).isZero();
    }

    @Test
    @DisplayName("Should reject an empty series")
    void shouldRejectEmptySeries() {
        assertThatThrownBy(() -> BaselineEstimator.estimate(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one point");
    }
}
