package com.healthsentinel.probes.api;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

public record ProbeContext(HttpClient httpClient, Clock clock, Executor blockingExecutor) {
    public ProbeContext {
        Objects.requireNonNull(httpClient, "httpClient is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(blockingExecutor, "blockingExecutor is required");
    }
}
