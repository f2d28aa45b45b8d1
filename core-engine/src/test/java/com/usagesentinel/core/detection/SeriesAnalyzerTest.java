package com.usagesentinel.core.detection;

import com.usagesentinel.core.exception.ErrorCode;
import com.usagesentinel.core.exception.InvalidInputException;
import com.usagesentinel.core.loader.InMemorySeriesLoader;
import com.usagesentinel.core.model.AnalyzedRecord;
import com.usagesentinel.core.model.CurrentAlert;
import com.usagesentinel.core.model.SeriesAnalysis;
import com.usagesentinel.core.model.SeriesKey;
import com.usagesentinel.core.model.SeriesStats;
import com.usagesentinel.core.model.Severity;
import com.usagesentinel.core.model.UsageRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeriesAnalyzer}.
 */
class SeriesAnalyzerTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 31);
    private static final SeriesKey KEY = new SeriesKey("North", "Central", "Paracetamol");

    private InMemorySeriesLoader loader;
    private SeriesAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        loader = new InMemorySeriesLoader();
        Clock clock = Clock.fixed(Instant.parse("2024-03-31T10:15:30Z"), ZoneOffset.UTC);
        analyzer = new SeriesAnalyzer(loader, clock);
    }

    @Test
    @DisplayName("Final jump to double the baseline raises a critical alert")
    void shouldFlagCriticalSpikeOnLastDay() {
        SeriesAnalysis analysis = analyzer.analyze(KEY, series(100, 100, 100, 100, 100, 100, 200));

        SeriesStats stats = analysis.getStats();
        assertThat(stats.getBaselineAverage()).isEqualTo(100.0);
        assertThat(stats.getSpikeThreshold()).isEqualTo(130.0);
        assertThat(stats.getTotalUsage()).isEqualTo(800.0);
        assertThat(stats.getAverageUsage()).isCloseTo(114.2857, within(1e-4));
        assertThat(stats.getMinUsage()).isEqualTo(100.0);
        assertThat(stats.getMaxUsage()).isEqualTo(200.0);
        assertThat(stats.getDataPoints()).isEqualTo(7);

        AnalyzedRecord last = analysis.getRecords().get(6);
        assertThat(last.isSpike()).isTrue();
        assertThat(last.getPercentAboveBaseline()).isCloseTo(100.0, within(1e-9));
        assertThat(analysis.getRecords().subList(0, 6)).noneMatch(AnalyzedRecord::isSpike);

        CurrentAlert alert = analysis.getAlert();
        assertThat(alert).isNotNull();
        assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.getAffectedDays()).isEqualTo(1);
        assertThat(alert.getPercentageIncrease()).isCloseTo(100.0, within(1e-9));
        assertThat(alert.getMessage()).isEqualTo(
                "Abnormal Paracetamol consumption detected in Central. "
                        + "Usage is 100.0% above baseline. Peak: 200 units.");
    }

    @Test
    @DisplayName("Flat series has no spikes and no alert")
    void shouldNotAlertOnFlatSeries() {
        SeriesAnalysis analysis = analyzer.analyze(KEY, series(Collections.nCopies(10, 100.0)));

        assertThat(analysis.getRecords()).hasSize(10).noneMatch(AnalyzedRecord::isSpike);
        assertThat(analysis.getAlert()).isNull();
        assertThat(analysis.alert()).isEmpty();
        assertThat(analysis.getStats().getMinUsage()).isEqualTo(100.0);
        assertThat(analysis.getStats().getMaxUsage()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Single data point cannot exceed its own baseline")
    void shouldNotAlertOnSinglePoint() {
        SeriesAnalysis analysis = analyzer.analyze(KEY, series(50));

        assertThat(analysis.getStats().getBaselineAverage()).isEqualTo(50.0);
        assertThat(analysis.getStats().getSpikeThreshold()).isCloseTo(65.0, within(1e-9));
        assertThat(analysis.getRecords()).singleElement()
                .satisfies(r -> assertThat(r.isSpike()).isFalse());
        assertThat(analysis.getAlert()).isNull();
    }

    @Test
    @DisplayName("Several recent spikes are counted and measured by the largest")
    void shouldAggregateRecentSpikes() {
        SeriesAnalysis analysis = analyzer.analyze(KEY,
                series(100, 100, 100, 100, 100, 100, 100, 135, 140, 145));

        CurrentAlert alert = analysis.getAlert();
        assertThat(alert.getAffectedDays()).isEqualTo(3);
        assertThat(alert.getPercentageIncrease()).isCloseTo(45.0, within(1e-9));
        assertThat(alert.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(alert.getMessage()).endsWith("Usage is 45.0% above baseline. Peak: 145 units.");
    }

    @Test
    @DisplayName("Spike older than the trailing seven records is flagged but not alerted")
    void shouldIgnoreSpikesOutsideRecentRecords() {
        List<Double> quantities = new ArrayList<>(Collections.nCopies(20, 100.0));
        quantities.set(10, 200.0);

        SeriesAnalysis analysis = analyzer.analyze(KEY, series(quantities));

        assertThat(analysis.getRecords().get(10).isSpike()).isTrue();
        assertThat(analysis.getAlert()).isNull();
    }

    @Test
    @DisplayName("Zero baseline yields unflagged records without stats or alert")
    void shouldHandleZeroBaseline() {
        SeriesAnalysis analysis = analyzer.analyze(KEY, series(0, 0, 0, 0, 0, 0, 10));

        assertThat(analysis.getRecords()).hasSize(7)
                .allSatisfy(r -> {
                    assertThat(r.isSpike()).isFalse();
                    assertThat(r.getPercentAboveBaseline()).isZero();
                });
        assertThat(analysis.getStats()).isNull();
        assertThat(analysis.getAlert()).isNull();
    }

    @Test
    @DisplayName("Empty window yields an empty analysis")
    void shouldReturnEmptyForNoData() {
        SeriesAnalysis analysis = analyzer.analyze(KEY, List.of());

        assertThat(analysis.getRecords()).isEmpty();
        assertThat(analysis.getStats()).isNull();
        assertThat(analysis.getAlert()).isNull();
    }

    @Test
    @DisplayName("Unordered input is analysed in date order")
    void shouldSortByDate() {
        List<UsageRecord> records = new ArrayList<>(series(100, 100, 100, 100, 100, 100, 200));
        Collections.reverse(records);

        SeriesAnalysis analysis = analyzer.analyze(KEY, records);

        assertThat(analysis.getRecords()).extracting(AnalyzedRecord::getDate).isSorted();
        assertThat(analysis.getAlert().getAffectedDays()).isEqualTo(1);
    }

    @Test
    @DisplayName("Repeated analysis of the same data gives the same result")
    void shouldBeIdempotent() {
        List<UsageRecord> records = series(100, 120, 90, 110, 100, 95, 180, 60);

        assertThat(analyzer.analyze(KEY, records)).isEqualTo(analyzer.analyze(KEY, records));
    }

    @Test
    @DisplayName("Missing window falls back to thirty days ending today")
    void shouldDefaultWindowToThirtyDays() {
        for (int i = 0; i <= 35; i++) {
            loader.add(record(TODAY.minusDays(i), 100));
        }

        assertThat(analyzer.analyze("North", "Central", "Paracetamol", null).getRecords()).hasSize(31);
        assertThat(analyzer.analyze("North", "Central", "Paracetamol", 0).getRecords()).hasSize(31);
        assertThat(analyzer.analyze("North", "Central", "Paracetamol", 7).getRecords())
                .hasSize(8)
                .first()
                .satisfies(r -> assertThat(r.getDate()).isEqualTo(TODAY.minusDays(7)));
    }

    @Test
    @DisplayName("Blank sub-region analyses the region-wide sum")
    void shouldAggregateSubRegions() {
        loader.add(new UsageRecord("North", "Central", "Paracetamol", TODAY, 40))
                .add(new UsageRecord("North", "East", "Paracetamol", TODAY, 60));

        SeriesAnalysis analysis = analyzer.analyze("North", " ", "Paracetamol", 30);

        assertThat(analysis.getRecords()).singleElement().satisfies(r -> {
            assertThat(r.getQuantity()).isEqualTo(100.0);
            assertThat(r.getSubRegion()).isNull();
        });
    }

    @Test
    @DisplayName("Should reject a missing region or item")
    void shouldRejectMissingKeyParts() {
        InvalidInputException e = catchThrowableOfType(
                () -> analyzer.analyze(" ", null, "Paracetamol", 30), InvalidInputException.class);
        assertThat(e).hasMessage("region and item are required");
        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.MISSING_REQUIRED_FIELD);
        assertThat(e.isRetryable()).isFalse();
        assertThatThrownBy(() -> analyzer.analyze("North", null, null, 30))
                .isInstanceOf(InvalidInputException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<UsageRecord> series(double... quantities) {
        List<Double> boxed = new ArrayList<>(quantities.length);
        for (double q : quantities) {
            boxed.add(q);
        }
        return series(boxed);
    }

    private static List<UsageRecord> series(List<Double> quantities) {
        List<UsageRecord> records = new ArrayList<>(quantities.size());
        LocalDate start = TODAY.minusDays(quantities.size() - 1L);
        for (int i = 0; i < quantities.size(); i++) {
            records.add(record(start.plusDays(i), quantities.get(i)));
        }
        return records;
    }

    private static UsageRecord record(LocalDate date, double quantity) {
        return new UsageRecord(KEY.getRegion(), KEY.getSubRegion(), KEY.getItem(), date, quantity);
    }
}
