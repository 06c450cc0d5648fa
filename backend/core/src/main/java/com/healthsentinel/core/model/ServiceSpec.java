package com.healthsentinel.core.model;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public record ServiceSpec(
        String name,
        String kind,
        Duration interval,
        Duration timeout,
        Map<String, Object> params,
        int failureThreshold
) {
    public ServiceSpec {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(interval, "interval is required");
        Objects.requireNonNull(timeout, "timeout is required");
        params = params == null ? Map.of() : Map.copyOf(params);
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1 for service " + name);
        }
    }

    public ServiceSpec(String name, String kind, Duration interval, Duration timeout, Map<String, Object> params) {
        this(name, kind, interval, timeout, params, 1);
    }

    // Same kind and params: recorded health stays meaningful.
    public boolean sameProbeTarget(ServiceSpec other) {
        return kind.equals(other.kind) && params.equals(other.params);
    }

    public ServiceSpec withInterval(Duration next) {
        return new ServiceSpec(name, kind, next, timeout, params, failureThreshold);
    }
}
