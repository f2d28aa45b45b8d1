package com.usagesentinel.service;

import com.usagesentinel.core.config.ConditionHintCatalog;
import com.usagesentinel.core.config.ConditionHintLoader;
import com.usagesentinel.core.detection.FleetScanner;
import com.usagesentinel.core.detection.SeriesAnalyzer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteDataSource;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the usage sentinel service.
 *
 * <h3>Startup</h3>
 *
 * <pre>
 *   ServiceConfig (environment)
 *     → condition hints (YAML)
 *     → usage store (SQLite, schema created if missing)
 *     → SeriesAnalyzer + FleetScanner
 *     → ApiServer (HTTP)
 * </pre>
 *
 * <p>
 * A shutdown hook stops the HTTP server and the fleet scan pool.
 * </p>
 *
 * @since 1.0.0
 */
public final class UsageSentinelServer {

    private static final Logger LOG = LoggerFactory.getLogger(UsageSentinelServer.class);

    private UsageSentinelServer() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting usage sentinel with config: {}", config);

        // 2. Load condition hints
        ConditionHintCatalog hints = ConditionHintLoader.resolve(config.getConditionHintsPath());

        // 3. Open the usage store
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl(config.getDatabaseUrl());
        UsageTableManager tableManager = new UsageTableManager(dataSource);
        tableManager.initializeTables();
        tableManager.validateSchema();
        JdbcSeriesLoader loader = new JdbcSeriesLoader(dataSource);

        // 4. Wire detection
        Clock clock = Clock.systemUTC();
        SeriesAnalyzer analyzer = new SeriesAnalyzer(loader, clock);
        FleetScanner scanner = new FleetScanner(loader, clock,
                config.getScanMaxConcurrency(), Duration.ofMillis(config.getScanTimeoutMs()));
        SentinelMetrics metrics = new SentinelMetrics(new SimpleMeterRegistry());

        // 5. Serve until shutdown
        ApiServer apiServer = new ApiServer(analyzer, scanner, loader, hints, metrics);
        apiServer.start(config.getHttpPort());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            apiServer.stop();
            scanner.close();
            stopped.countDown();
        }, "sentinel-shutdown"));
        stopped.await();
    }
}
