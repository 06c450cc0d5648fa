package com.healthsentinel.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.healthsentinel.core.model.HealthState;
import com.healthsentinel.core.model.StateTransition;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TemplateRendererTest {
    private static final StateTransition DOWN = new StateTransition(
            "cache-a",
            "tcp",
            HealthState.UP,
            HealthState.DOWN,
            Instant.parse("2026-03-04T05:06:07Z"),
            42,
            "connection refused",
            Map.of("host", "10.0.0.5")
    );

    @Test
    void substitutesKnownVariables() {
        String rendered = TemplateRenderer.render(
                "service_name={{service_name}} kind={{service_type}} {{old_state}}->{{new_state}} "
                        + "at {{timestamp}} in {{latency_ms}}ms error_message={{error_message}} host={{metadata_host}}",
                DOWN
        );

        assertEquals("service_name=cache-a kind=tcp UP->DOWN at 2026-03-04 05:06:07 in 42ms "
                + "error_message=connection refused host=10.0.0.5", rendered);
    }

    @Test
    void leavesUnknownPlaceholdersLiteral() {
        assertEquals("{{nope}} cache-a {{ also_missing }}",
                TemplateRenderer.render("{{nope}} {{ service_name }} {{ also_missing }}", DOWN));
    }

    @Test
    void firstObservationRendersUnknownOldStateAndEmptyError() {
        StateTransition initial = new StateTransition(
                "db-a", "http", null, HealthState.DEGRADED, Instant.parse("2026-03-04T05:06:07Z"), 0, null, Map.of());

        assertEquals("UNKNOWN->DEGRADED []",
                TemplateRenderer.render("{{old_state}}->{{status}} [{{error_message}}]", initial));
    }

    @Test
    void jsonTemplatesEscapeSubstitutedValues() throws Exception {
        StateTransition nasty = new StateTransition(
                "api \"edge\"", "http", HealthState.UP, HealthState.DOWN, Instant.parse("2026-03-04T05:06:07Z"),
                7, "line1\nline2", Map.of("code", 503));

        String rendered = TemplateRenderer.render(
                "{\"text\": \"{{service_name}}: {{error_message}}\", \"meta\": {{metadata_json}}}", nasty);

        JsonNode tree = JsonUtils.objectMapper().readTree(rendered);
        assertEquals("api \"edge\": line1\nline2", tree.get("text").asText());
        assertEquals(503, tree.get("meta").get("code").asInt());
    }

    @Test
    void replacementTextWithDollarSignsIsKeptVerbatim() {
        StateTransition dollars = new StateTransition(
                "billing", "http", HealthState.UP, HealthState.DOWN, Instant.parse("2026-03-04T05:06:07Z"),
                1, "cost $1 \\ more", Map.of());

        assertEquals("cost $1 \\ more", TemplateRenderer.render("{{error_message}}", dollars));
    }
}
