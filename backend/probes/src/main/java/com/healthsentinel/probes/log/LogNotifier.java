package com.healthsentinel.probes.log;

import com.healthsentinel.core.model.HealthState;
import com.healthsentinel.core.model.NotifierSpec;
import com.healthsentinel.probes.api.DeliveryResult;
import com.healthsentinel.probes.api.Notifier;
import com.healthsentinel.probes.api.RenderedMessage;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

public class LogNotifier implements Notifier {
    public static final String KIND = "log";

    private final Logger logger;

    public LogNotifier() {
        this(Logger.getLogger("com.healthsentinel.alerts"));
    }

    public LogNotifier(Logger logger) {
        this.logger = logger;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public CompletableFuture<DeliveryResult> deliver(RenderedMessage message, NotifierSpec spec, Duration timeout) {
        Level level = message.transition() != null && message.transition().newState() == HealthState.UP
                ? Level.INFO
                : Level.WARNING;
        String subject = message.subject() == null || message.subject().isBlank() ? "" : message.subject() + " | ";
        logger.log(level, "[" + spec.name() + "] " + subject + message.body());
        return CompletableFuture.completedFuture(DeliveryResult.delivered());
    }
}
