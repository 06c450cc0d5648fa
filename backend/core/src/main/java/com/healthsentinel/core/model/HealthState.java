package com.healthsentinel.core.model;

import java.util.Locale;

public enum HealthState {
    UP,
    DOWN,
    DEGRADED;

    public boolean healthy() {
        return this == UP;
    }

    public static HealthState parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Health state must not be blank");
        }
        return HealthState.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
