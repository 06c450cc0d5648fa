package com.healthsentinel.core.events;

import java.time.Instant;

public record DeliveryAttempted(
        Instant timestamp,
        String notifierName,
        String serviceName,
        int attempt,
        boolean success,
        String error
) implements Event {
    @Override
    public String type() {
        return "DeliveryAttempted";
    }
}
