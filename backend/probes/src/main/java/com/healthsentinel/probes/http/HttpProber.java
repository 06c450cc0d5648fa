package com.healthsentinel.probes.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.healthsentinel.core.model.CheckOutcome;
import com.healthsentinel.core.model.HealthState;
import com.healthsentinel.core.model.ServiceSpec;
import com.healthsentinel.core.util.JsonUtils;
import com.healthsentinel.probes.api.Failures;
import com.healthsentinel.probes.api.Params;
import com.healthsentinel.probes.api.ProbeContext;
import com.healthsentinel.probes.api.Prober;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Issues one HTTP request and judges the response.
 * <p>
 * Parameters: {@code url} (required), {@code method}, {@code headers}, {@code body} or {@code json},
 * {@code expected_status} (one code or a list; any 2xx when absent), {@code expected_content} (one or
 * more substrings that must all appear), {@code degraded_latency_ms} (slower successful responses are
 * reported {@code DEGRADED}).
 */
public class HttpProber implements Prober {
    public static final String KIND = "http";
    private static final Set<String> METHODS = Set.of("GET", "HEAD", "POST", "PUT", "DELETE", "OPTIONS", "PATCH");

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public void validate(ServiceSpec spec) {
        String url = Params.requiredString(spec.params(), "url");
        URI uri = URI.create(url);
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("Invalid url: " + url);
        }
        String method = method(spec);
        if (!METHODS.contains(method)) {
            throw new IllegalArgumentException("Unsupported HTTP method " + method + "; supported: " + METHODS);
        }
        Params.intList(spec.params(), "expected_status", List.of());
        Params.stringMap(spec.params(), "headers");
    }

    @Override
    public CompletableFuture<CheckOutcome> probe(ServiceSpec spec, ProbeContext ctx) {
        Instant startedAt = ctx.clock().instant();
        HttpRequest request;
        try {
            request = buildRequest(spec);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(
                    CheckOutcome.down(spec.name(), KIND, 0, Failures.describe(e), startedAt));
        }

        return ctx.httpClient().sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    Instant finishedAt = ctx.clock().instant();
                    long latencyMillis = Duration.between(startedAt, finishedAt).toMillis();
                    if (error != null) {
                        return CheckOutcome.down(spec.name(), KIND, latencyMillis, Failures.describe(error), finishedAt);
                    }
                    return judge(spec, response, latencyMillis, finishedAt);
                });
    }

    private CheckOutcome judge(ServiceSpec spec, HttpResponse<String> response, long latencyMillis, Instant at) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("status_code", response.statusCode());
        String body = response.body() == null ? "" : response.body();
        metadata.put("content_length", body.length());

        List<Integer> expectedStatus = Params.intList(spec.params(), "expected_status", List.of());
        boolean statusOk = expectedStatus.isEmpty()
                ? response.statusCode() >= 200 && response.statusCode() < 300
                : expectedStatus.contains(response.statusCode());
        if (!statusOk) {
            return new CheckOutcome(spec.name(), KIND, HealthState.DOWN, latencyMillis,
                    "HTTP status " + response.statusCode() + " from " + spec.params().get("url"), metadata, at);
        }

        for (String expected : Params.stringList(spec.params(), "expected_content")) {
            if (!body.contains(expected)) {
                return new CheckOutcome(spec.name(), KIND, HealthState.DOWN, latencyMillis,
                        "Response does not contain '" + expected + "'", metadata, at);
            }
        }

        int degradedAfter = Params.optionalInt(spec.params(), "degraded_latency_ms", 0);
        if (degradedAfter > 0 && latencyMillis > degradedAfter) {
            return new CheckOutcome(spec.name(), KIND, HealthState.DEGRADED, latencyMillis,
                    "Slow response: " + latencyMillis + "ms > " + degradedAfter + "ms", metadata, at);
        }
        return CheckOutcome.up(spec.name(), KIND, latencyMillis, metadata, at);
    }

    private HttpRequest buildRequest(ServiceSpec spec) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(Params.requiredString(spec.params(), "url")))
                .timeout(spec.timeout());
        Params.stringMap(spec.params(), "headers").forEach(builder::header);
        String method = method(spec);
        HttpRequest.BodyPublisher body = bodyPublisher(spec, builder);
        return builder.method(method, body).build();
    }

    private HttpRequest.BodyPublisher bodyPublisher(ServiceSpec spec, HttpRequest.Builder builder) {
        Object json = spec.params().get("json");
        if (json != null) {
            try {
                builder.header("Content-Type", "application/json");
                return HttpRequest.BodyPublishers.ofString(JsonUtils.objectMapper().writeValueAsString(json));
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Parameter 'json' is not serializable", e);
            }
        }
        Object body = spec.params().get("body");
        return body == null ? HttpRequest.BodyPublishers.noBody() : HttpRequest.BodyPublishers.ofString(body.toString());
    }

    private static String method(ServiceSpec spec) {
        return Params.optionalString(spec.params(), "method", "GET").toUpperCase(Locale.ROOT);
    }
}
