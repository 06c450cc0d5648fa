package com.healthsentinel.service.config;

import java.util.Locale;
import java.util.logging.Level;

public final class LogLevels {
    private LogLevels() {
    }

    public static Level parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("log level must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "DEBUG" -> Level.FINE;
            case "TRACE" -> Level.FINEST;
            case "WARN" -> Level.WARNING;
            case "ERROR", "CRITICAL", "FATAL" -> Level.SEVERE;
            default -> Level.parse(normalized);
        };
    }
}
