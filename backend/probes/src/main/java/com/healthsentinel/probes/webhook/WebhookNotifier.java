package com.healthsentinel.probes.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.healthsentinel.core.model.NotifierSpec;
import com.healthsentinel.core.util.JsonUtils;
import com.healthsentinel.probes.api.DeliveryResult;
import com.healthsentinel.probes.api.Failures;
import com.healthsentinel.probes.api.Notifier;
import com.healthsentinel.probes.api.Params;
import com.healthsentinel.probes.api.RenderedMessage;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Sends the rendered body to an HTTP endpoint (chat robots, incident tools, custom receivers).
 * <p>
 * Parameters: {@code url} (required), {@code method} (POST, PUT or PATCH), {@code headers}.
 * A 2xx response is a success unless its JSON body carries a non-zero {@code errcode}, which is how
 * chat robot webhooks report rejected messages.
 */
public class WebhookNotifier implements Notifier {
    public static final String KIND = "webhook";
    private static final Logger LOGGER = Logger.getLogger(WebhookNotifier.class.getName());
    private static final Set<String> METHODS = Set.of("POST", "PUT", "PATCH");
    private static final int MAX_LOGGED_BODY = 200;

    private final HttpClient httpClient;

    public WebhookNotifier(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public void validate(NotifierSpec spec) {
        String url = Params.requiredString(spec.params(), "url");
        URI uri = URI.create(url);
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("Invalid url: " + url);
        }
        String method = method(spec);
        if (!METHODS.contains(method)) {
            throw new IllegalArgumentException("Unsupported webhook method " + method + "; supported: " + METHODS);
        }
        Params.stringMap(spec.params(), "headers");
    }

    @Override
    public CompletableFuture<DeliveryResult> deliver(RenderedMessage message, NotifierSpec spec, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(Params.requiredString(spec.params(), "url")))
                .timeout(timeout)
                .header("Content-Type", contentType(message.body()));
        Params.stringMap(spec.params(), "headers").forEach(builder::setHeader);
        HttpRequest request = builder.method(method(spec), HttpRequest.BodyPublishers.ofString(message.body())).build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        return DeliveryResult.failed(Failures.describe(error));
                    }
                    return interpret(spec, response);
                });
    }

    private DeliveryResult interpret(NotifierSpec spec, HttpResponse<String> response) {
        String body = response.body() == null ? "" : response.body();
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            LOGGER.warning("Webhook " + spec.name() + " answered " + response.statusCode() + ": " + abbreviate(body));
            return DeliveryResult.failed("HTTP status " + response.statusCode());
        }
        JsonNode json = parseQuietly(body);
        if (json != null && json.has("errcode") && json.get("errcode").asInt() != 0) {
            return DeliveryResult.failed("errcode=" + json.get("errcode").asText() + " errmsg=" + json.path("errmsg").asText());
        }
        return DeliveryResult.delivered();
    }

    private static JsonNode parseQuietly(String body) {
        String trimmed = body.strip();
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            return JsonUtils.objectMapper().readTree(trimmed);
        } catch (IOException notJson) {
            return null;
        }
    }

    private static String contentType(String body) {
        String trimmed = body.strip();
        boolean json = (trimmed.startsWith("{") && trimmed.endsWith("}")) || (trimmed.startsWith("[") && trimmed.endsWith("]"));
        return json ? "application/json" : "text/plain; charset=utf-8";
    }

    private static String method(NotifierSpec spec) {
        return Params.optionalString(spec.params(), "method", "POST").toUpperCase(Locale.ROOT);
    }

    private static String abbreviate(String body) {
        return body.length() <= MAX_LOGGED_BODY ? body : body.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
