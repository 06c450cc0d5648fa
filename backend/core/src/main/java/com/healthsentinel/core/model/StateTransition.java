package com.healthsentinel.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

// oldState is null for the first observation of a service.
public record StateTransition(
        String serviceName,
        String serviceKind,
        HealthState oldState,
        HealthState newState,
        Instant timestamp,
        long latencyMillis,
        String error,
        Map<String, Object> metadata
) {
    public StateTransition {
        Objects.requireNonNull(serviceName, "serviceName is required");
        Objects.requireNonNull(newState, "newState is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static StateTransition from(HealthState oldState, CheckOutcome outcome) {
        return new StateTransition(
                outcome.serviceName(),
                outcome.serviceKind(),
                oldState,
                outcome.state(),
                outcome.timestamp(),
                outcome.latencyMillis(),
                outcome.error(),
                outcome.metadata()
        );
    }
}
