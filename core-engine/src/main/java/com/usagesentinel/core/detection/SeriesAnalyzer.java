package com.usagesentinel.core.detection;

import com.usagesentinel.core.exception.InvalidInputException;
import com.usagesentinel.core.loader.SeriesLoader;
import com.usagesentinel.core.model.AnalyzedRecord;
import com.usagesentinel.core.model.CurrentAlert;
import com.usagesentinel.core.model.SeriesAnalysis;
import com.usagesentinel.core.model.SeriesKey;
import com.usagesentinel.core.model.SeriesStats;
import com.usagesentinel.core.model.Severity;
import com.usagesentinel.core.model.UsageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Objects;

/**
 * Analyses one series: baseline, per-day spike flags, summary statistics and
 * an optional alert for the most recent days.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Sort the window's records by date.</li>
 * <li>Estimate the baseline over the whole window with
 * {@link BaselineEstimator}.</li>
 * <li>Annotate every record with {@link SpikeClassifier}.</li>
 * <li>Summarise total, mean, min and max over the window.</li>
 * <li>Look at the trailing {@value #RECENT_RECORDS} records; if any is a
 * spike, raise a {@link CurrentAlert} measured from the largest
 * percentage among them.</li>
 * </ol>
 *
 * <h3>Degenerate input</h3>
 * <p>
 * An empty window yields {@link SeriesAnalysis#empty()}. A zero baseline
 * (every history day at zero) yields the records unflagged with a 0%
 * deviation, no stats and no alert.
 * </p>
 *
 * <p>
 * Stateless and thread-safe: each call loads and computes everything anew.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesAnalyzer.class);

    /** Window used when the caller gives none or a non-positive one. */
    public static final int DEFAULT_WINDOW_DAYS = 30;

    /** Number of trailing records that form the evaluation window. */
    public static final int RECENT_RECORDS = 7;

    private final SeriesLoader loader;
    private final Clock clock;

    /**
     * @param loader data source; must not be {@code null}
     * @param clock  source of "today" for the date window; must not be
     *               {@code null}
     */
    public SeriesAnalyzer(SeriesLoader loader, Clock clock) {
        this.loader = Objects.requireNonNull(loader, "SeriesLoader must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Load and analyse a series ending today.
     *
     * @param region     region name; required
     * @param subRegion  sub-region name; blank or {@code null} means all
     *                   sub-regions
     * @param item       item name; required
     * @param windowDays window length in days; {@code null} or non-positive
     *                   falls back to {@value #DEFAULT_WINDOW_DAYS}
     * @return the analysis; never {@code null}
     * @throws InvalidInputException if region or item is missing
     * @throws com.usagesentinel.core.exception.DataAccessException if loading
     *                                                              fails
     */
    public SeriesAnalysis analyze(String region, String subRegion, String item, Integer windowDays) {
        if (region == null || region.isBlank()) {
            throw new InvalidInputException("region and item are required");
        }
        if (item == null || item.isBlank()) {
            throw new InvalidInputException("region and item are required");
        }
        String sub = subRegion == null || subRegion.isBlank() ? null : subRegion;
        int days = windowDays == null || windowDays <= 0 ? DEFAULT_WINDOW_DAYS : windowDays;

        LocalDate endDate = LocalDate.now(clock);
        LocalDate startDate = endDate.minusDays(days);
        SeriesKey key = new SeriesKey(region, sub, item);

        List<UsageRecord> records = loader.load(region, sub, item, startDate, endDate);
        LOG.debug("Loaded {} record(s) for {} between {} and {}", records.size(), key, startDate, endDate);
        return analyze(key, records);
    }

    /**
     * Analyse records that are already loaded.
     *
     * @param key     the series the records belong to; used for the alert
     *                message
     * @param records records of the window in any order; must not be
     *                {@code null}
     * @return the analysis; never {@code null}
     */
    public SeriesAnalysis analyze(SeriesKey key, List<UsageRecord> records) {
        Objects.requireNonNull(key, "SeriesKey must not be null");
        Objects.requireNonNull(records, "records must not be null");

        if (records.isEmpty()) {
            return SeriesAnalysis.empty();
        }

        List<UsageRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparing(UsageRecord::getDate));

        List<Double> quantities = ordered.stream().map(UsageRecord::getQuantity).toList();
        double baseline = BaselineEstimator.estimate(quantities);

        if (baseline <= 0) {
            LOG.debug("Series {} has a zero baseline over {} point(s) - no alert possible", key, ordered.size());
            List<AnalyzedRecord> unflagged = ordered.stream()
                    .map(r -> new AnalyzedRecord(r, false, 0))
                    .toList();
            return new SeriesAnalysis(unflagged, null, null);
        }

        List<AnalyzedRecord> analyzed = ordered.stream()
                .map(r -> SpikeClassifier.classify(r, baseline))
                .toList();

        DoubleSummaryStatistics summary = quantities.stream()
                .mapToDouble(Double::doubleValue)
                .summaryStatistics();
        SeriesStats stats = new SeriesStats(
                summary.getSum(),
                summary.getAverage(),
                baseline,
                SpikeClassifier.threshold(baseline),
                summary.getMin(),
                summary.getMax(),
                ordered.size());

        CurrentAlert alert = recentAlert(key, analyzed);
        if (alert != null) {
            LOG.debug("Series {} has an active {} spike: {}% over {} day(s)", key,
                    alert.getSeverity().label(), alert.getPercentageIncrease(), alert.getAffectedDays());
        }
        return new SeriesAnalysis(analyzed, stats, alert);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static CurrentAlert recentAlert(SeriesKey key, List<AnalyzedRecord> analyzed) {
        int from = Math.max(0, analyzed.size() - RECENT_RECORDS);
        List<AnalyzedRecord> spiking = analyzed.subList(from, analyzed.size()).stream()
                .filter(AnalyzedRecord::isSpike)
                .toList();
        if (spiking.isEmpty()) {
            return null;
        }

        double maxPercent = Double.NEGATIVE_INFINITY;
        double peak = Double.NEGATIVE_INFINITY;
        for (AnalyzedRecord r : spiking) {
            maxPercent = Math.max(maxPercent, r.getPercentAboveBaseline());
            peak = Math.max(peak, r.getQuantity());
        }

        return new CurrentAlert(
                Severity.fromPercentageIncrease(maxPercent),
                AlertMessages.currentAlert(key, maxPercent, peak),
                spiking.size(),
                maxPercent);
    }
}
