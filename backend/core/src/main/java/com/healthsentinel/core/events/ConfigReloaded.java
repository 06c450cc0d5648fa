package com.healthsentinel.core.events;

import java.time.Instant;
import java.util.List;

public record ConfigReloaded(
        Instant timestamp,
        List<String> addedServices,
        List<String> removedServices,
        List<String> changedServices,
        List<String> changedNotifiers
) implements Event {
    @Override
    public String type() {
        return "ConfigReloaded";
    }
}
