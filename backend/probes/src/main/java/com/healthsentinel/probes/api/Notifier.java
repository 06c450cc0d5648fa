package com.healthsentinel.probes.api;

import com.healthsentinel.core.model.NotifierSpec;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

// A single attempt per call; retries belong to the dispatcher.
public interface Notifier {
    String kind();

    CompletableFuture<DeliveryResult> deliver(RenderedMessage message, NotifierSpec spec, Duration timeout);

    default void validate(NotifierSpec spec) {
    }
}
