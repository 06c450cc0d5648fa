package com.healthsentinel.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthsentinel.core.events.AlertDelivered;
import com.healthsentinel.core.events.AlertRaised;
import com.healthsentinel.core.events.ConfigRejected;
import com.healthsentinel.core.events.ConfigReloaded;
import com.healthsentinel.core.events.DeliveryAttempted;
import com.healthsentinel.core.events.Event;
import com.healthsentinel.core.events.ProbeCompleted;
import com.healthsentinel.core.events.ProbeSkipped;
import com.healthsentinel.core.events.StateChanged;
import com.healthsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

// {"type": ..., "timestamp": ..., "event": {...}} per line
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "ProbeCompleted", ProbeCompleted.class,
            "ProbeSkipped", ProbeSkipped.class,
            "StateChanged", StateChanged.class,
            "DeliveryAttempted", DeliveryAttempted.class,
            "AlertDelivered", AlertDelivered.class,
            "AlertRaised", AlertRaised.class,
            "ConfigReloaded", ConfigReloaded.class,
            "ConfigRejected", ConfigRejected.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event", e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
