package com.crisisnavigator.service.api;

import com.crisisnavigator.collectors.api.ActivityLog;
import com.crisisnavigator.collectors.api.CollectorResult;
import com.crisisnavigator.collectors.api.DisasterStore;
import com.crisisnavigator.core.model.Disaster;
import com.crisisnavigator.core.util.JsonUtils;
import com.crisisnavigator.service.runtime.SchedulerService;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    static final int DEFAULT_ACTIVITY_LIMIT = 20;
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final String DISASTERS_PATH = "/api/disasters";

    private final int port;
    private final DisasterStore disasterStore;
    private final ActivityLog activityLog;
    private final SchedulerService scheduler;
    private final SseBroadcaster sseBroadcaster;
    private final DiagnosticsTracker diagnosticsTracker;
    private final List<String> ingestCollectors;
    private final String analysisCollector;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            DisasterStore disasterStore,
            ActivityLog activityLog,
            SchedulerService scheduler,
            SseBroadcaster sseBroadcaster,
            DiagnosticsTracker diagnosticsTracker,
            List<String> ingestCollectors,
            String analysisCollector
    ) {
        this.port = port;
        this.disasterStore = disasterStore;
        this.activityLog = activityLog;
        this.scheduler = scheduler;
        this.sseBroadcaster = sseBroadcaster;
        this.diagnosticsTracker = diagnosticsTracker;
        this.ingestCollectors = List.copyOf(ingestCollectors);
        this.analysisCollector = analysisCollector;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext(DISASTERS_PATH, this::handleDisasters);
            server.createContext("/api/stats", this::handleStats);
            server.createContext("/api/activities", this::handleActivities);
            server.createContext("/api/collectors/status", this::handleCollectorStatus);
            server.createContext("/api/ingest", this::handleIngest);
            server.createContext("/api/analyze", this::handleAnalyze);
            server.createContext("/api/stream", sseBroadcaster::handle);
            server.start();
            LOGGER.info("API server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("metrics", diagnosticsTracker.metricsSnapshot());
        writeJson(exchange, 200, body);
    }

    private void handleDisasters(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        String path = exchange.getRequestURI().getPath();
        if (path.equals(DISASTERS_PATH) || path.equals(DISASTERS_PATH + "/")) {
            writeJson(exchange, 200, disasterStore.listAll());
            return;
        }
        if (!path.startsWith(DISASTERS_PATH + "/")) {
            writeJson(exchange, 404, Map.of("error", "Not found"));
            return;
        }
        String rest = path.substring(DISASTERS_PATH.length() + 1);
        String id = URLDecoder.decode(rest, StandardCharsets.UTF_8);
        Optional<Disaster> disaster = disasterStore.get(id);
        if (disaster.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "Disaster not found"));
            return;
        }
        writeJson(exchange, 200, disaster.get());
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, disasterStore.stats());
    }

    private void handleActivities(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        int limit;
        try {
            String raw = queryParams(exchange.getRequestURI()).get("limit");
            limit = raw == null || raw.isBlank() ? DEFAULT_ACTIVITY_LIMIT : Integer.parseInt(raw.trim());
        } catch (NumberFormatException invalidLimit) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        if (limit < 1) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        writeJson(exchange, 200, activityLog.recent(limit));
    }

    private void handleCollectorStatus(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        List<Map<String, Object>> statuses = new ArrayList<>();
        for (SchedulerService.ScheduledCollector scheduled : scheduler.scheduledCollectors()) {
            String name = scheduled.collector().name();
            Map<String, Object> status = new HashMap<>(diagnosticsTracker.collectorSnapshot(name));
            status.put("name", name);
            status.put("enabled", scheduled.enabled());
            status.put("intervalSeconds", scheduled.interval().toSeconds());
            status.put("running", scheduler.isRunning(name));
            status.put("skippedTicks", scheduler.skippedTicks(name));
            statuses.add(status);
        }
        writeJson(exchange, 200, statuses);
    }

    private void handleIngest(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        List<CompletableFuture<CollectorResult>> started = new ArrayList<>();
        List<String> busy = new ArrayList<>();
        for (String name : ingestCollectors) {
            Optional<CompletableFuture<CollectorResult>> run = scheduler.runNow(name);
            if (run.isPresent()) {
                started.add(run.get());
            } else if (scheduler.hasCollector(name)) {
                busy.add(name);
            }
        }
        if (started.isEmpty()) {
            writeJson(exchange, 409, Map.of("error", "Data ingestion already running", "busy", busy));
            return;
        }
        List<CollectorResult> results = new ArrayList<>();
        for (CompletableFuture<CollectorResult> run : started) {
            results.add(run.join());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Data ingestion completed");
        body.put("results", results);
        body.put("busy", busy);
        writeJson(exchange, 200, body);
    }

    private void handleAnalyze(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        if (analysisCollector == null || !scheduler.hasCollector(analysisCollector)) {
            writeJson(exchange, 503, Map.of("error", "Analysis is disabled"));
            return;
        }
        Optional<CompletableFuture<CollectorResult>> run = scheduler.runNow(analysisCollector);
        if (run.isEmpty()) {
            writeJson(exchange, 409, Map.of("error", "Analysis already running"));
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Analysis processing completed");
        body.put("result", run.get().join());
        writeJson(exchange, 200, body);
    }

    private boolean ensureMethod(HttpExchange exchange, String method) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", method + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        try {
            payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to encode response for " + exchange.getRequestURI(), e);
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
            return;
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
