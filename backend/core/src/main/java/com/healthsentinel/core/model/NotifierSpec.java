package com.healthsentinel.core.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public record NotifierSpec(
        String name,
        String kind,
        Map<String, Object> params,
        String subjectTemplate,
        String bodyTemplate,
        RetryPolicy retry,
        int maxConcurrentDeliveries,
        Set<HealthState> notifyOn
) {
    public static final String DEFAULT_SUBJECT = "[{{status}}] {{service_name}}";
    public static final String DEFAULT_BODY =
            "Service {{service_name}} ({{service_type}}) changed {{old_state}} -> {{new_state}} at {{timestamp}}. "
                    + "Latency: {{latency_ms}}ms. Error: {{error_message}}";

    public NotifierSpec {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(retry, "retry is required");
        params = params == null ? Map.of() : Map.copyOf(params);
        bodyTemplate = bodyTemplate == null ? DEFAULT_BODY : bodyTemplate;
        notifyOn = notifyOn == null || notifyOn.isEmpty()
                ? Set.copyOf(EnumSet.allOf(HealthState.class))
                : Set.copyOf(notifyOn);
        if (maxConcurrentDeliveries < 0) {
            throw new IllegalArgumentException("maxConcurrentDeliveries must be >= 0");
        }
    }

    public NotifierSpec(String name, String kind, Map<String, Object> params, String bodyTemplate, RetryPolicy retry) {
        this(name, kind, params, null, bodyTemplate, retry, 0, null);
    }

    public boolean triggersOn(HealthState state) {
        return notifyOn.contains(state);
    }
}
