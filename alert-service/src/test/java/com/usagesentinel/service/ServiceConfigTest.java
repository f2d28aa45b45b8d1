package com.usagesentinel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should fall back to defaults when nothing is set")
    void shouldUseDefaults() {
        ServiceConfig config = ServiceConfig.fromMap(Map.of());

        assertThat(config.getHttpPort()).isEqualTo(8080);
        assertThat(config.getDatabaseUrl()).isEqualTo("jdbc:sqlite:usage.db");
        assertThat(config.getScanMaxConcurrency()).isEqualTo(8);
        assertThat(config.getScanTimeoutMs()).isEqualTo(30_000L);
        assertThat(config.getConditionHintsPath()).isEmpty();
    }

    @Test
    @DisplayName("Should read every variable")
    void shouldReadEnvironment() {
        ServiceConfig config = ServiceConfig.fromMap(Map.of(
                "HTTP_PORT", "9090",
                "DATABASE_URL", "jdbc:sqlite:/data/usage.db",
                "SCAN_MAX_CONCURRENCY", "2",
                "SCAN_TIMEOUT_MS", "1500",
                "CONDITION_HINTS_PATH", "/etc/hints.yml"));

        assertThat(config.getHttpPort()).isEqualTo(9090);
        assertThat(config.getDatabaseUrl()).isEqualTo("jdbc:sqlite:/data/usage.db");
        assertThat(config.getScanMaxConcurrency()).isEqualTo(2);
        assertThat(config.getScanTimeoutMs()).isEqualTo(1500L);
        assertThat(config.getConditionHintsPath()).isEqualTo("/etc/hints.yml");
    }

    @Test
    @DisplayName("Blank values count as unset")
    void shouldTreatBlankAsUnset() {
        ServiceConfig config = ServiceConfig.fromMap(Map.of("HTTP_PORT", "  "));

        assertThat(config.getHttpPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Should fail fast on an unparsable number")
    void shouldRejectUnparsableNumber() {
        assertThatThrownBy(() -> ServiceConfig.fromMap(Map.of("SCAN_TIMEOUT_MS", "soon")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse");
    }

    @Test
    @DisplayName("Builder should reject out-of-range values")
    void shouldRejectOutOfRange() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().httpPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("httpPort");
        assertThatThrownBy(() -> new ServiceConfig.Builder().scanMaxConcurrency(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scanMaxConcurrency");
        assertThatThrownBy(() -> new ServiceConfig.Builder().scanTimeoutMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ServiceConfig.Builder().databaseUrl("usage.db").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JDBC");
    }
}
