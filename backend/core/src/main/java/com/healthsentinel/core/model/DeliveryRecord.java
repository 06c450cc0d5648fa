package com.healthsentinel.core.model;

import java.time.Instant;

public record DeliveryRecord(
        String notifierName,
        String serviceName,
        HealthState newState,
        boolean success,
        int attempts,
        String lastError,
        Instant completedAt
) {
}
