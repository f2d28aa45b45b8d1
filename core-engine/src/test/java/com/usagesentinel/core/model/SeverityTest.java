package com.usagesentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Severity}.
 */
class SeverityTest {

    @Test
    @DisplayName("Fifty percent or more is critical")
    void shouldBeCriticalFromFiftyPercent() {
        assertThat(Severity.fromPercentageIncrease(50.0)).isEqualTo(Severity.CRITICAL);
        assertThat(Severity.fromPercentageIncrease(230.0)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Below fifty percent is a warning")
    void shouldBeWarningBelowFiftyPercent() {
        assertThat(Severity.fromPercentageIncrease(30.0)).isEqualTo(Severity.WARNING);
        assertThat(Severity.fromPercentageIncrease(49.99)).isEqualTo(Severity.WARNING);
    }

    @Test
    @DisplayName("Critical sorts before warning")
    void shouldOrderCriticalFirst() {
        assertThat(Severity.CRITICAL).isLessThan(Severity.WARNING);
    }

    @Test
    @DisplayName("Wire label is lowercase")
    void shouldUseLowercaseLabel() {
        assertThat(Severity.CRITICAL.label()).isEqualTo("critical");
        assertThat(Severity.WARNING.label()).isEqualTo("warning");
    }
}
