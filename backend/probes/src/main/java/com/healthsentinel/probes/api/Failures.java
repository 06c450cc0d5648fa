package com.healthsentinel.probes.api;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

public final class Failures {
    public static final String TIMEOUT = "timeout";

    private Failures() {
    }

    public static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    public static String describe(Throwable error) {
        Throwable root = rootCause(error);
        if (root instanceof TimeoutException || root instanceof HttpTimeoutException
                || root instanceof SocketTimeoutException) {
            return TIMEOUT;
        }
        if (root instanceof CancellationException) {
            return "cancelled";
        }
        String message = root.getMessage();
        return message == null || message.isBlank() ? root.getClass().getSimpleName() : message;
    }
}
