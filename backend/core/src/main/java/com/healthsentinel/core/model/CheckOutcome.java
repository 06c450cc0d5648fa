package com.healthsentinel.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record CheckOutcome(
        String serviceName,
        String serviceKind,
        HealthState state,
        long latencyMillis,
        String error,
        Map<String, Object> metadata,
        Instant timestamp
) {
    public CheckOutcome {
        Objects.requireNonNull(serviceName, "serviceName is required");
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static CheckOutcome up(String serviceName, String serviceKind, long latencyMillis,
                                  Map<String, Object> metadata, Instant timestamp) {
        return new CheckOutcome(serviceName, serviceKind, HealthState.UP, latencyMillis, null, metadata, timestamp);
    }

    public static CheckOutcome down(String serviceName, String serviceKind, long latencyMillis,
                                    String error, Instant timestamp) {
        return new CheckOutcome(serviceName, serviceKind, HealthState.DOWN, latencyMillis, error, Map.of(), timestamp);
    }

    public boolean healthy() {
        return state.healthy();
    }
}
