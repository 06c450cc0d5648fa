package com.healthsentinel.core.events;

import java.time.Instant;

public record ProbeSkipped(Instant timestamp, String serviceName, String reason) implements Event {
    @Override
    public String type() {
        return "ProbeSkipped";
    }
}
