package com.healthsentinel.core.model;

import java.time.Instant;

public record ServiceState(
        String serviceName,
        HealthState state,
        Instant lastTransitionAt,
        CheckOutcome lastOutcome,
        int consecutiveFailures
) {
    public ServiceState withOutcome(CheckOutcome outcome, int failures) {
        return new ServiceState(serviceName, state, lastTransitionAt, outcome, failures);
    }
}
