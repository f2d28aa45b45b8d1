package com.usagesentinel.core.detection;

import com.usagesentinel.core.exception.ErrorCode;
import com.usagesentinel.core.exception.ScanTimeoutException;
import com.usagesentinel.core.loader.SeriesLoader;
import com.usagesentinel.core.model.FleetAlert;
import com.usagesentinel.core.model.FleetScanResult;
import com.usagesentinel.core.model.SeriesKey;
import com.usagesentinel.core.model.Severity;
import com.usagesentinel.core.model.UsageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sweeps every known series for active spikes and ranks the results.
 *
 * <h3>Per-key evaluation</h3>
 * <ol>
 * <li>Fetch the last {@value #LOOKBACK_DAYS} days of exactly that key;
 * a key without a sub-region is never summed with its siblings.</li>
 * <li>Skip it when it holds fewer than {@value #MIN_DATA_POINTS} points or
 * its baseline is zero.</li>
 * <li>Flag spikes among the records dated within the
 * {@value #RECENT_DAYS} calendar days ending today.</li>
 * <li>Raise one {@link FleetAlert} measured from the peak spiking quantity,
 * dated at the latest spiking day.</li>
 * </ol>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Fetches run on a fixed pool of {@code maxConcurrency} threads so a large
 * key set never floods the data source. Results are ranked after
 * collection, so scheduling order never shows in the output. A key whose
 * fetch fails is logged and skipped; the sweep carries on. When the scan
 * deadline passes, unfinished fetches are cancelled and a
 * {@link ScanTimeoutException} is thrown.
 * </p>
 *
 * @since 1.0.0
 */
public class FleetScanner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FleetScanner.class);

    /** Days of history fetched per key. */
    public static final int LOOKBACK_DAYS = 30;

    /** Calendar days, ending today inclusive, that form the evaluation window. */
    public static final int RECENT_DAYS = 7;

    /** Keys with fewer points in the lookback are not evaluated. */
    public static final int MIN_DATA_POINTS = 7;

    /** Critical first, then larger increase first, then by key. */
    static final Comparator<FleetAlert> RANKING = Comparator
            .comparing(FleetAlert::getSeverity)
            .thenComparing(Comparator.comparingDouble(FleetAlert::getPercentageIncrease).reversed())
            .thenComparing(FleetAlert::key);

    private final SeriesLoader loader;
    private final Clock clock;
    private final Duration timeout;
    private final ExecutorService executor;

    /**
     * @param loader         data source; must not be {@code null}
     * @param clock          source of "today"; must not be {@code null}
     * @param maxConcurrency maximum number of concurrent fetches; at least 1
     * @param timeout        deadline for a whole scan; must be positive
     * @throws IllegalArgumentException if {@code maxConcurrency} or
     *                                  {@code timeout} is out of range
     */
    public FleetScanner(SeriesLoader loader, Clock clock, int maxConcurrency, Duration timeout) {
        this.loader = Objects.requireNonNull(loader, "SeriesLoader must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got: " + maxConcurrency);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }

        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(maxConcurrency, r -> {
            Thread t = new Thread(r, "fleet-scan-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Scan every series matching the optional filters.
     *
     * @param regionFilter only this region, or {@code null}/blank for all
     * @param itemFilter   only this item, or {@code null}/blank for all
     * @return ranked alerts; never {@code null}
     * @throws com.usagesentinel.core.exception.DataAccessException if the
     *                                                              keys cannot
     *                                                              be listed
     * @throws ScanTimeoutException if the deadline passes or the calling
     *                              thread is interrupted
     */
    public FleetScanResult scan(String regionFilter, String itemFilter) {
        long startNanos = System.nanoTime();
        String region = blankToNull(regionFilter);
        String item = blankToNull(itemFilter);
        LocalDate today = LocalDate.now(clock);

        List<SeriesKey> keys = new ArrayList<>(new TreeSet<>(loader.listKeys(region, item)));
        if (keys.isEmpty()) {
            LOG.info("Fleet scan found no series (region={}, item={})", region, item);
            return new FleetScanResult(List.of());
        }

        List<Callable<Optional<FleetAlert>>> tasks = new ArrayList<>(keys.size());
        for (SeriesKey key : keys) {
            tasks.add(() -> evaluate(key, fetch(key, today), today));
        }

        List<Future<Optional<FleetAlert>>> futures;
        try {
            futures = executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanTimeoutException("Fleet scan interrupted", ErrorCode.SCAN_INTERRUPTED, e);
        }

        List<FleetAlert> alerts = new ArrayList<>();
        int failed = 0;
        int unfinished = 0;
        for (int i = 0; i < futures.size(); i++) {
            Future<Optional<FleetAlert>> future = futures.get(i);
            try {
                future.get().ifPresent(alerts::add);
            } catch (CancellationException e) {
                unfinished++;
            } catch (ExecutionException e) {
                failed++;
                LOG.warn("Skipping series {}: {}", keys.get(i), e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ScanTimeoutException("Fleet scan interrupted", ErrorCode.SCAN_INTERRUPTED, e);
            }
        }

        if (unfinished > 0) {
            throw new ScanTimeoutException(String.format(
                    "Fleet scan exceeded %d ms; %d of %d series unfinished",
                    timeout.toMillis(), unfinished, keys.size()));
        }

        alerts.sort(RANKING);
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        LOG.info("Fleet scan evaluated {} series in {} ms: {} alert(s), {} failed",
                keys.size(), durationMs, alerts.size(), failed);
        return new FleetScanResult(alerts);
    }

    /**
     * Evaluate one already-fetched series.
     *
     * @param key    the series
     * @param series the lookback records in any order
     * @param today  reference date for the evaluation window
     * @return an alert if a recent day spikes, otherwise empty
     */
    Optional<FleetAlert> evaluate(SeriesKey key, List<UsageRecord> series, LocalDate today) {
        if (series.size() < MIN_DATA_POINTS) {
            LOG.debug("Skipping series {}: {} point(s) < {}", key, series.size(), MIN_DATA_POINTS);
            return Optional.empty();
        }

        List<UsageRecord> ordered = new ArrayList<>(series);
        ordered.sort(Comparator.comparing(UsageRecord::getDate));
        double baseline = BaselineEstimator.estimate(
                ordered.stream().map(UsageRecord::getQuantity).toList());

        if (baseline <= 0) {
            LOG.debug("Skipping series {}: zero baseline", key);
            return Optional.empty();
        }

        LocalDate recentStart = today.minusDays(RECENT_DAYS - 1L);
        List<UsageRecord> spiking = ordered.stream()
                .filter(r -> !r.getDate().isBefore(recentStart))
                .filter(r -> SpikeClassifier.isSpike(r.getQuantity(), baseline))
                .toList();
        if (spiking.isEmpty()) {
            return Optional.empty();
        }

        double peak = spiking.stream().mapToDouble(UsageRecord::getQuantity).max().orElseThrow();
        double percentageIncrease = SpikeClassifier.percentAboveBaseline(peak, baseline);
        LocalDate detectedAt = spiking.get(spiking.size() - 1).getDate();

        return Optional.of(FleetAlert.builder()
                .key(key)
                .percentageIncrease(percentageIncrease)
                .severity(Severity.fromPercentageIncrease(percentageIncrease))
                .message(AlertMessages.fleetAlert(key, percentageIncrease))
                .peakUsage(peak)
                .baselineAvg(Math.round(baseline))
                .detectedAt(detectedAt)
                .build());
    }

    /**
     * Shut down the worker pool, interrupting any fetch still running.
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<UsageRecord> fetch(SeriesKey key, LocalDate today) {
        return loader.loadKey(key, today.minusDays(LOOKBACK_DAYS), today);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
