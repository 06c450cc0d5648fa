package com.healthsentinel.core.events;

import java.time.Instant;
import java.util.List;

public record ConfigRejected(Instant timestamp, String source, List<String> problems) implements Event {
    @Override
    public String type() {
        return "ConfigRejected";
    }
}
