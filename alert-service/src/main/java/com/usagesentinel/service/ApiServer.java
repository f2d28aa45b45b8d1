package com.usagesentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.usagesentinel.core.config.ConditionHintCatalog;
import com.usagesentinel.core.detection.FleetScanner;
import com.usagesentinel.core.detection.SeriesAnalyzer;
import com.usagesentinel.core.exception.DataAccessException;
import com.usagesentinel.core.exception.ErrorCode;
import com.usagesentinel.core.exception.InvalidInputException;
import com.usagesentinel.core.exception.ScanTimeoutException;
import com.usagesentinel.core.exception.SentinelException;
import com.usagesentinel.core.loader.SeriesLoader;
import com.usagesentinel.core.model.FilterOptions;
import com.usagesentinel.core.model.FleetAlert;
import com.usagesentinel.core.model.FleetScanResult;
import com.usagesentinel.core.model.SeriesAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP front end for the detection core.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET|POST /api/usage}: analyse one series. Parameters
 * {@code region}, {@code subRegion}, {@code item}, {@code days} come from the
 * query string or a JSON body; body values win.</li>
 * <li>{@code GET /api/alerts?region=&item=}: fleet scan</li>
 * <li>{@code GET /api/filters}: regions, items and sub-regions</li>
 * <li>{@code GET /health}, {@code GET /readiness}: {@code {"status":"UP"}}</li>
 * <li>{@code GET /metrics}: snapshot of every meter</li>
 * </ul>
 *
 * <h3>Errors</h3>
 * <p>
 * Failures are answered with {@code {"error": message, "code": errorCode}}:
 * 400 for rejected input, 503 when the store cannot be read, 504 when a scan
 * runs out of time, 404/405 for unknown paths and methods, 500 otherwise.
 * </p>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}; requests run on a small pool of
 * daemon threads.
 * </p>
 *
 * @since 1.0.0
 */
public class ApiServer {

    private static final Logger LOG = LoggerFactory.getLogger(ApiServer.class);

    private static final int REQUEST_THREADS = 4;
    private static final Map<String, String> HEALTH_RESPONSE = Map.of("status", "UP");
    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {
    };

    private final SeriesAnalyzer analyzer;
    private final FleetScanner scanner;
    private final SeriesLoader loader;
    private final ConditionHintCatalog hints;
    private final SentinelMetrics metrics;
    private final ObjectMapper mapper;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ApiServer(SeriesAnalyzer analyzer, FleetScanner scanner, SeriesLoader loader,
            ConditionHintCatalog hints, SentinelMetrics metrics) {
        this.analyzer = Objects.requireNonNull(analyzer, "SeriesAnalyzer must not be null");
        this.scanner = Objects.requireNonNull(scanner, "FleetScanner must not be null");
        this.loader = Objects.requireNonNull(loader, "SeriesLoader must not be null");
        this.hints = Objects.requireNonNull(hints, "ConditionHintCatalog must not be null");
        this.metrics = Objects.requireNonNull(metrics, "SentinelMetrics must not be null");
        this.mapper = ObjectMappers.create();
    }

    /**
     * Start serving on the given port.
     *
     * @param port TCP port; 0 binds an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("HTTP port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            LOG.error("Failed to bind HTTP server on port {}: {}", port, e.getMessage(), e);
            throw new UncheckedIOException("Failed to bind HTTP server on port " + port, e);
        }

        route("/api/usage", Set.of("GET", "POST"), this::handleUsage);
        route("/api/alerts", Set.of("GET"), this::handleAlerts);
        route("/api/filters", Set.of("GET"), exchange -> FilterOptions.from(loader.listKeys(null, null)));
        route("/health", Set.of("GET"), exchange -> HEALTH_RESPONSE);
        route("/readiness", Set.of("GET"), exchange -> HEALTH_RESPONSE);
        route("/metrics", Set.of("GET"), exchange -> metrics.snapshot());
        server.createContext("/", exchange -> {
            try {
                sendError(exchange, 404, "Not found: " + exchange.getRequestURI().getPath(), null);
            } finally {
                exchange.close();
            }
        });

        AtomicInteger threadIndex = new AtomicInteger();
        executor = Executors.newFixedThreadPool(REQUEST_THREADS, r -> {
            Thread t = new Thread(r, "api-server-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("API server started on port {}", getPort());
    }

    /**
     * Stop the server and release its request threads.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("API server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, useful after starting on port 0
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private Object handleUsage(HttpExchange exchange) throws IOException {
        Map<String, String> params = new HashMap<>(queryParams(exchange));
        if ("POST".equals(exchange.getRequestMethod())) {
            params.putAll(bodyParams(exchange));
        }

        SeriesAnalysis analysis = analyzer.analyze(
                params.get("region"),
                params.get("subRegion"),
                params.get("item"),
                parseDays(params.get("days")));
        metrics.recordAnalysis(analysis);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("usage", analysis.getRecords());
        response.put("stats", analysis.getStats());
        response.put("alert", analysis.getAlert());
        response.put("conditionHint", analysis.alert().isPresent()
                ? hints.lookup(params.get("item")).orElse(null)
                : null);
        return response;
    }

    private Object handleAlerts(HttpExchange exchange) {
        Map<String, String> params = queryParams(exchange);
        long start = System.nanoTime();
        FleetScanResult result = scanner.scan(params.get("region"), params.get("item"));
        metrics.recordScan(result, System.nanoTime() - start);

        List<Map<String, Object>> alerts = new ArrayList<>(result.getAlerts().size());
        for (FleetAlert alert : result.getAlerts()) {
            Map<String, Object> entry = mapper.convertValue(alert, BODY_TYPE);
            entry.put("conditionHint", hints.lookup(alert.getItem()).orElse(null));
            alerts.add(entry);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("alerts", alerts);
        response.put("totalAlerts", result.getTotalAlerts());
        response.put("criticalCount", result.getCriticalCount());
        response.put("warningCount", result.getWarningCount());
        return response;
    }

    // ---------------------------------------------------------------
    // Routing and error mapping
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface Endpoint {
        Object handle(HttpExchange exchange) throws IOException;
    }

    private void route(String path, Set<String> methods, Endpoint endpoint) {
        server.createContext(path, exchange -> {
            try {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    sendError(exchange, 404, "Not found: " + exchange.getRequestURI().getPath(), null);
                    return;
                }
                if (!methods.contains(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", String.join(", ", methods));
                    sendError(exchange, 405, "Method not allowed: " + exchange.getRequestMethod(), null);
                    return;
                }
                dispatch(exchange, endpoint);
            } finally {
                exchange.close();
            }
        });
    }

    private void dispatch(HttpExchange exchange, Endpoint endpoint) throws IOException {
        try {
            sendJson(exchange, 200, endpoint.handle(exchange));
        } catch (InvalidInputException e) {
            LOG.debug("Rejected {} {}: {}", exchange.getRequestMethod(), exchange.getRequestURI(), e.getMessage());
            sendError(exchange, 400, e.getMessage(), e.getErrorCode());
        } catch (DataAccessException e) {
            LOG.warn("Data access failed for {}: {}", exchange.getRequestURI(), e.getMessage());
            sendError(exchange, 503, e.getMessage(), e.getErrorCode());
        } catch (ScanTimeoutException e) {
            LOG.warn("Fleet scan failed for {}: {}", exchange.getRequestURI(), e.getMessage());
            sendError(exchange, 504, e.getMessage(), e.getErrorCode());
        } catch (SentinelException | IOException e) {
            LOG.error("Request {} failed: {}", exchange.getRequestURI(), e.getMessage(), e);
            sendError(exchange, 500, "Internal server error", null);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure handling {}", exchange.getRequestURI(), e);
            sendError(exchange, 500, "Internal server error", null);
        }
    }

    private void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int status, String message, ErrorCode code) throws IOException {
        metrics.recordError(status);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (code != null) {
            body.put("code", code.getCode());
        }
        sendJson(exchange, status, body);
    }

    // ---------------------------------------------------------------
    // Request parsing
    // ---------------------------------------------------------------

    private static Map<String, String> queryParams(HttpExchange exchange) {
        return parseQuery(exchange.getRequestURI().getRawQuery());
    }

    /**
     * @param query raw (still percent-encoded) query string; may be
     *              {@code null}
     * @return decoded non-blank parameters, last occurrence wins
     * @throws InvalidInputException if an escape sequence is malformed
     */
    static Map<String, String> parseQuery(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String name = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            if (!name.isEmpty() && !value.isBlank()) {
                params.put(name, value);
            }
        }
        return params;
    }

    private Map<String, String> bodyParams(HttpExchange exchange) throws IOException {
        byte[] raw;
        try (InputStream is = exchange.getRequestBody()) {
            raw = is.readAllBytes();
        }
        if (raw.length == 0) {
            return Map.of();
        }

        Map<String, Object> body;
        try {
            body = mapper.readValue(raw, BODY_TYPE);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Request body is not a JSON object", ErrorCode.MALFORMED_REQUEST, e);
        }

        Map<String, String> params = new HashMap<>();
        if (body == null) {
            return params;
        }
        body.forEach((name, value) -> {
            String text = bodyValue(value);
            if (text != null && !text.isBlank()) {
                params.put(name, text);
            }
        });
        return params;
    }

    // 14.0 in JSON reads back as a Double; keep whole numbers integral.
    private static String bodyValue(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) {
                return Long.toString(n.longValue());
            }
        }
        return value == null ? null : value.toString();
    }

    static Integer parseDays(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException("days must be an integer, got: " + raw, ErrorCode.INVALID_WINDOW, e);
        }
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Malformed query string near '" + s + "'",
                    ErrorCode.MALFORMED_REQUEST, e);
        }
    }
}
