package com.usagesentinel.service;

import com.usagesentinel.core.model.FleetScanResult;
import com.usagesentinel.core.model.SeriesAnalysis;
import com.usagesentinel.core.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the usage sentinel service.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code usage_sentinel_series_analyzed_total}: single-series analyses
 * served</li>
 * <li>{@code usage_sentinel_fleet_scans_total}: completed fleet scans</li>
 * <li>{@code usage_sentinel_alerts_raised_total{severity}}: alerts returned,
 * per severity</li>
 * <li>{@code usage_sentinel_request_errors_total{status}}: failed requests,
 * per HTTP status</li>
 * <li>{@code usage_sentinel_scan_duration}: fleet scan latency</li>
 * </ul>
 */
public class SentinelMetrics {

    private final MeterRegistry registry;
    private final Counter seriesAnalyzed;
    private final Counter fleetScans;
    private final Map<Severity, Counter> alertsRaised = new EnumMap<>(Severity.class);
    private final Timer scanDuration;

    public SentinelMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");

        this.seriesAnalyzed = Counter.builder("usage_sentinel_series_analyzed_total")
                .description("Single-series analyses served")
                .register(registry);
        this.fleetScans = Counter.builder("usage_sentinel_fleet_scans_total")
                .description("Completed fleet scans")
                .register(registry);
        for (Severity severity : Severity.values()) {
            alertsRaised.put(severity, Counter.builder("usage_sentinel_alerts_raised_total")
                    .description("Alerts returned to callers")
                    .tag("severity", severity.label())
                    .register(registry));
        }
        this.scanDuration = Timer.builder("usage_sentinel_scan_duration")
                .description("Fleet scan latency")
                .register(registry);
    }

    public void recordAnalysis(SeriesAnalysis analysis) {
        seriesAnalyzed.increment();
        analysis.alert().ifPresent(a -> alertsRaised.get(a.getSeverity()).increment());
    }

    public void recordScan(FleetScanResult result, long durationNanos) {
        fleetScans.increment();
        scanDuration.record(durationNanos, TimeUnit.NANOSECONDS);
        result.getAlerts().forEach(a -> alertsRaised.get(a.getSeverity()).increment());
    }

    public void recordError(int status) {
        registry.counter("usage_sentinel_request_errors_total", "status", Integer.toString(status))
                .increment();
    }

    /**
     * Flatten every registered meter into {@code name{tags} -> {statistic: value}}.
     *
     * @return snapshot ordered by meter name
     */
    public Map<String, Map<String, Double>> snapshot() {
        Map<String, Map<String, Double>> out = new TreeMap<>();
        for (Meter meter : registry.getMeters()) {
            StringBuilder name = new StringBuilder(meter.getId().getName());
            if (!meter.getId().getTags().isEmpty()) {
                name.append('{');
                meter.getId().getTags().forEach(t -> name.append(t.getKey()).append('=').append(t.getValue()).append(','));
                name.setCharAt(name.length() - 1, '}');
            }
            Map<String, Double> values = new LinkedHashMap<>();
            for (Measurement m : meter.measure()) {
                values.put(m.getStatistic().getTagValueRepresentation(), m.getValue());
            }
            out.put(name.toString(), values);
        }
        return out;
    }
}
