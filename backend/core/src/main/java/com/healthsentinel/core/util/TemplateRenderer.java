package com.healthsentinel.core.util;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.healthsentinel.core.model.StateTransition;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code {{variable}}} placeholders. Pure: no I/O, no failure on unknown variables, which stay
 * in the output literally.
 * <p>
 * A template that is itself a JSON object or array gets its substituted values JSON-escaped, so a
 * webhook payload stays valid when an error message contains quotes or newlines. {@code metadata_json}
 * is inserted raw because it already is JSON.
 */
public final class TemplateRenderer {
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
    public static final String METADATA_PREFIX = "metadata_";
    public static final String UNKNOWN_STATE = "UNKNOWN";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.\\-]+)\\s*}}");
    private static final Set<String> RAW_JSON_VARIABLES = Set.of("metadata_json");

    private TemplateRenderer() {
    }

    public static String render(String template, StateTransition transition) {
        return render(template, variables(transition));
    }

    public static String render(String template, Map<String, String> variables) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        boolean jsonTemplate = looksLikeJson(template);
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + 64);
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = variables.get(name);
            String replacement;
            if (value == null) {
                replacement = matcher.group();
            } else if (jsonTemplate && !RAW_JSON_VARIABLES.contains(name)) {
                replacement = new String(JsonStringEncoder.getInstance().quoteAsString(value));
            } else {
                replacement = value;
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public static Map<String, String> variables(StateTransition transition) {
        Map<String, String> vars = new LinkedHashMap<>();
        String oldState = transition.oldState() == null ? UNKNOWN_STATE : transition.oldState().name();
        String kind = transition.serviceKind() == null ? "" : transition.serviceKind();
        vars.put("service_name", transition.serviceName());
        vars.put("service_type", kind);
        vars.put("service_kind", kind);
        vars.put("old_state", oldState);
        vars.put("new_state", transition.newState().name());
        vars.put("status", transition.newState().name());
        vars.put("timestamp", TIMESTAMP_FORMAT.format(transition.timestamp()));
        vars.put("latency_ms", Long.toString(transition.latencyMillis()));
        vars.put("response_time", Long.toString(transition.latencyMillis()));
        vars.put("error_message", transition.error() == null ? "" : transition.error());
        for (Map.Entry<String, Object> entry : transition.metadata().entrySet()) {
            vars.put(METADATA_PREFIX + entry.getKey(), String.valueOf(entry.getValue()));
        }
        vars.put("metadata_json", metadataJson(transition.metadata()));
        return vars;
    }

    private static String metadataJson(Map<String, Object> metadata) {
        return JsonUtils.toJson(metadata);
    }

    private static boolean looksLikeJson(String template) {
        String trimmed = template.strip();
        return (trimmed.startsWith("{") && trimmed.endsWith("}"))
                || (trimmed.startsWith("[") && trimmed.endsWith("]"));
    }
}
