package com.healthsentinel.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public record MonitorConfig(
        GlobalSettings global,
        Map<String, ServiceSpec> services,
        Map<String, NotifierSpec> notifiers
) {
    public MonitorConfig {
        Objects.requireNonNull(global, "global is required");
        services = services == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(services));
        notifiers = notifiers == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(notifiers));
    }

    public static MonitorConfig empty() {
        return new MonitorConfig(GlobalSettings.DEFAULTS, Map.of(), Map.of());
    }
}
