package com.healthsentinel.core.events;

import com.healthsentinel.core.model.HealthState;

import java.time.Instant;

public record ProbeCompleted(
        Instant timestamp,
        String serviceName,
        HealthState state,
        long latencyMillis,
        String error
) implements Event {
    @Override
    public String type() {
        return "ProbeCompleted";
    }
}
