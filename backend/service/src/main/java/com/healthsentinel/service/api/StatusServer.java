package com.healthsentinel.service.api;

import com.healthsentinel.core.events.Event;
import com.healthsentinel.core.model.HealthState;
import com.healthsentinel.core.model.ServiceSpec;
import com.healthsentinel.core.model.ServiceState;
import com.healthsentinel.core.model.ServiceStats;
import com.healthsentinel.core.model.StateTransition;
import com.healthsentinel.core.util.JsonUtils;
import com.healthsentinel.service.runtime.AlertDispatcher;
import com.healthsentinel.service.runtime.ProbeTiming;
import com.healthsentinel.service.runtime.SchedulerService;
import com.healthsentinel.service.runtime.StateTracker;
import com.healthsentinel.service.store.EventStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only JSON view of the running monitor.
 * <ul>
 *   <li>{@code GET /api/health}: liveness plus per-state service counts</li>
 *   <li>{@code GET /api/services}: configured services with their recorded state, probe times and statistics</li>
 *   <li>{@code GET /api/transitions?service=&since=&limit=}: transition history, newest first</li>
 *   <li>{@code GET /api/deliveries?limit=}: recent alert deliveries, newest first</li>
 *   <li>{@code GET /api/events?since=&type=&limit=}: event log, when one is configured</li>
 * </ul>
 */
public class StatusServer {
    private static final Logger LOGGER = Logger.getLogger(StatusServer.class.getName());
    private static final int DEFAULT_LIMIT = 100;

    private final int port;
    private final SchedulerService scheduler;
    private final StateTracker tracker;
    private final AlertDispatcher dispatcher;
    private final EventStore eventStore;

    private HttpServer server;
    private ExecutorService executor;

    // eventStore may be null; /api/events then answers 404.
    public StatusServer(int port, SchedulerService scheduler, StateTracker tracker, AlertDispatcher dispatcher,
                        EventStore eventStore) {
        this.port = port;
        this.scheduler = scheduler;
        this.tracker = tracker;
        this.dispatcher = dispatcher;
        this.eventStore = eventStore;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(4);
            server.setExecutor(executor);
            server.createContext("/api/health", exchange -> serve(exchange, this::health));
            server.createContext("/api/services", exchange -> serve(exchange, this::services));
            server.createContext("/api/transitions", exchange -> serve(exchange, this::transitions));
            server.createContext("/api/deliveries", exchange -> serve(exchange, this::deliveries));
            server.createContext("/api/events", exchange -> serve(exchange, this::events));
            server.start();
            LOGGER.info("Status API listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting status API on port " + port, e);
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

    private Response health(Map<String, String> query) {
        Map<HealthState, Integer> counts = new EnumMap<>(HealthState.class);
        for (HealthState state : HealthState.values()) {
            counts.put(state, 0);
        }
        tracker.allStates().values().forEach(state -> counts.merge(state.state(), 1, Integer::sum));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("services", scheduler.scheduledServices().size());
        body.put("states", counts);
        body.put("probesInFlight", scheduler.inFlightCount());
        return new Response(200, body);
    }

    private Response services(Map<String, String> query) {
        Map<String, ServiceState> states = tracker.allStates();
        Map<String, ProbeTiming> timings = new HashMap<>();
        scheduler.probeTimings().forEach(timing -> timings.put(timing.serviceName(), timing));
        List<Map<String, Object>> dto = new ArrayList<>();
        for (ServiceSpec spec : scheduler.scheduledServices()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", spec.name());
            entry.put("kind", spec.kind());
            entry.put("intervalSeconds", spec.interval().toMillis() / 1000.0);
            entry.put("timeoutSeconds", spec.timeout().toMillis() / 1000.0);
            ServiceState state = states.get(spec.name());
            if (state != null) {
                entry.put("state", state.state());
                entry.put("lastTransitionAt", state.lastTransitionAt());
                entry.put("consecutiveFailures", state.consecutiveFailures());
                if (state.lastOutcome() != null) {
                    entry.put("lastCheckedAt", state.lastOutcome().timestamp());
                    entry.put("latencyMillis", state.lastOutcome().latencyMillis());
                    if (state.lastOutcome().error() != null) {
                        entry.put("error", state.lastOutcome().error());
                    }
                }
            }
            ProbeTiming timing = timings.get(spec.name());
            if (timing != null && timing.lastProbeAt() != null) {
                entry.put("lastProbeAt", timing.lastProbeAt());
                entry.put("nextProbeAt", timing.nextProbeAt());
            }
            ServiceStats stats = tracker.stats(spec.name());
            Map<String, Object> statsDto = new LinkedHashMap<>();
            statsDto.put("totalChecks", stats.totalChecks());
            statsDto.put("healthyChecks", stats.healthyChecks());
            statsDto.put("unhealthyChecks", stats.unhealthyChecks());
            statsDto.put("healthRate", stats.healthRate());
            statsDto.put("averageLatencyMillis", stats.averageLatencyMillis());
            statsDto.put("stateChanges", stats.stateChanges());
            entry.put("stats", statsDto);
            dto.add(entry);
        }
        return new Response(200, dto);
    }

    private Response transitions(Map<String, String> query) {
        String service = Optional.ofNullable(query.get("service")).filter(value -> !value.isBlank()).orElse(null);
        Instant since = query.containsKey("since") ? Instant.parse(query.get("since")) : null;
        List<StateTransition> history = tracker.history(service, since, limit(query));
        return new Response(200, history);
    }

    private Response deliveries(Map<String, String> query) {
        return new Response(200, dispatcher.recentDeliveries(limit(query)));
    }

    private Response events(Map<String, String> query) {
        if (eventStore == null) {
            return new Response(404, Map.of("error", "event_log_disabled"));
        }
        Instant since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
        Optional<String> type = Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank());
        List<Event> events = eventStore.query(since, type, limit(query));
        return new Response(200, events);
    }

    private void serve(HttpExchange exchange, Handler handler) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1);
                return;
            }
            Response response;
            try {
                response = handler.handle(queryParams(exchange.getRequestURI()));
            } catch (RuntimeException invalidParamError) {
                if (isBadQuery(invalidParamError)) {
                    response = new Response(400, Map.of("error", "invalid_query_params"));
                } else {
                    LOGGER.log(Level.WARNING, "Status request " + exchange.getRequestURI() + " failed", invalidParamError);
                    response = new Response(500, Map.of("error", "internal_error"));
                }
            }
            writeJson(exchange, response.status(), response.body());
        } finally {
            exchange.close();
        }
    }

    private static boolean isBadQuery(RuntimeException error) {
        return error instanceof IllegalArgumentException || error instanceof DateTimeParseException;
    }

    private static int limit(Map<String, String> query) {
        int limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : DEFAULT_LIMIT;
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return limit;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
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

    @FunctionalInterface
    private interface Handler {
        Response handle(Map<String, String> query);
    }

    private record Response(int status, Object body) {
    }
}
