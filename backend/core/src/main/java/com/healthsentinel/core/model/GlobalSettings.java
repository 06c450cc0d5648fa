package com.healthsentinel.core.model;

import java.time.Duration;
import java.util.Objects;

// Null file paths disable persistence; status port 0 disables the status API.
public record GlobalSettings(
        Duration defaultInterval,
        Duration defaultTimeout,
        int maxConcurrentProbes,
        int historySize,
        boolean alertOnInitialFailure,
        String stateFile,
        String eventLogFile,
        Duration reloadInterval,
        Duration shutdownGrace,
        Duration suppressRepeatWithin,
        int statusPort,
        String logLevel
) {
    public static final GlobalSettings DEFAULTS = new GlobalSettings(
            Duration.ofSeconds(30),
            Duration.ofSeconds(10),
            10,
            200,
            true,
            null,
            null,
            Duration.ofSeconds(5),
            Duration.ofSeconds(10),
            Duration.ZERO,
            0,
            "INFO"
    );

    public GlobalSettings {
        Objects.requireNonNull(defaultInterval, "defaultInterval is required");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout is required");
        Objects.requireNonNull(reloadInterval, "reloadInterval is required");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace is required");
        Objects.requireNonNull(suppressRepeatWithin, "suppressRepeatWithin is required");
    }
}
