package com.healthsentinel.service.config;

import com.healthsentinel.core.model.GlobalSettings;
import com.healthsentinel.core.model.HealthState;
import com.healthsentinel.core.model.MonitorConfig;
import com.healthsentinel.core.model.NotifierSpec;
import com.healthsentinel.core.model.RetryPolicy;
import com.healthsentinel.core.model.ServiceSpec;
import com.healthsentinel.probes.api.KindRegistry;
import com.healthsentinel.probes.api.Notifier;
import com.healthsentinel.probes.api.Prober;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns a parsed configuration document into a {@link MonitorConfig}, or reports everything wrong with it.
 * <p>
 * Durations are given in seconds (fractions allowed) or as ISO-8601 strings. Keys of a service or notifier
 * entry that the monitor does not interpret itself are handed to the prober or notifier as parameters.
 * Notifiers may be declared either as a {@code notifiers} map or as an {@code alerts} list of entries
 * carrying a {@code name}.
 */
public class ConfigValidator {
    private static final Logger LOGGER = Logger.getLogger(ConfigValidator.class.getName());

    private static final Set<String> SERVICE_KEYS = Set.of("type", "enabled", "check_interval", "timeout", "failure_threshold");
    private static final Set<String> NOTIFIER_KEYS = Set.of(
            "name", "type", "enabled", "subject", "subject_template", "template", "body_template",
            "max_attempts", "max_retries", "retry_delay", "retry_backoff", "max_retry_delay", "timeout",
            "max_concurrent", "notify_on"
    );
    private static final Map<String, String> PROBE_KIND_ALIASES = Map.of("restful", "http");
    private static final Map<String, String> NOTIFIER_KIND_ALIASES = Map.of("http", "webhook");

    private final KindRegistry<Prober> probers;
    private final KindRegistry<Notifier> notifiers;

    public ConfigValidator(KindRegistry<Prober> probers, KindRegistry<Notifier> notifiers) {
        this.probers = probers;
        this.notifiers = notifiers;
    }

    public MonitorConfig validate(Map<String, Object> document) {
        List<String> problems = new ArrayList<>();
        GlobalSettings global = global(section(document, "global", problems), problems);

        Map<String, ServiceSpec> services = new LinkedHashMap<>();
        section(document, "services", problems).forEach((name, raw) -> {
            ServiceSpec spec = service(name, raw, global, problems);
            if (spec != null) {
                services.put(name, spec);
            }
        });

        Map<String, NotifierSpec> notifierSpecs = new LinkedHashMap<>();
        section(document, "notifiers", problems).forEach((name, raw) -> addNotifier(name, raw, notifierSpecs, problems));
        Object alerts = document.get("alerts");
        if (alerts instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                Object raw = list.get(i);
                Object name = raw instanceof Map<?, ?> entry ? entry.get("name") : null;
                if (name == null || name.toString().isBlank()) {
                    problems.add("alerts[" + i + "]: name is required");
                    continue;
                }
                addNotifier(name.toString(), raw, notifierSpecs, problems);
            }
        } else if (alerts != null) {
            problems.add("alerts: must be a list");
        }

        if (!problems.isEmpty()) {
            throw new ConfigValidationException(problems);
        }
        return new MonitorConfig(global, services, notifierSpecs);
    }

    private GlobalSettings global(Map<String, Object> raw, List<String> problems) {
        GlobalSettings d = GlobalSettings.DEFAULTS;
        Entry e = new Entry("global", raw, problems);
        String logLevel = e.string("log_level", d.logLevel());
        try {
            LogLevels.parse(logLevel);
        } catch (IllegalArgumentException ex) {
            problems.add("global: unknown log_level '" + logLevel + "'");
        }
        return new GlobalSettings(
                e.positiveSeconds("check_interval", d.defaultInterval()),
                e.positiveSeconds("timeout", d.defaultTimeout()),
                e.integer("max_concurrent_checks", d.maxConcurrentProbes(), 1, Integer.MAX_VALUE),
                e.integer("history_size", d.historySize(), 1, Integer.MAX_VALUE),
                e.bool("alert_on_initial_failure", d.alertOnInitialFailure()),
                e.string("state_file", d.stateFile()),
                e.string("event_log_file", d.eventLogFile()),
                e.positiveSeconds("reload_interval", d.reloadInterval()),
                e.seconds("shutdown_grace", d.shutdownGrace()),
                e.seconds("suppress_repeat_within", d.suppressRepeatWithin()),
                e.integer("status_port", d.statusPort(), 0, 65535),
                logLevel
        );
    }

    private ServiceSpec service(String name, Object raw, GlobalSettings global, List<String> problems) {
        String path = "services." + name;
        if (!(raw instanceof Map<?, ?>)) {
            problems.add(path + ": must be a map");
            return null;
        }
        Entry e = new Entry(path, asMap(raw), problems);
        if (!e.bool("enabled", true)) {
            LOGGER.info("Service " + name + " is disabled");
            return null;
        }
        int before = problems.size();
        String kind = e.kind(probers.kinds(), PROBE_KIND_ALIASES);
        Duration interval = e.positiveSeconds("check_interval", global.defaultInterval());
        Duration timeout = e.positiveSeconds("timeout", global.defaultTimeout());
        int threshold = e.integer("failure_threshold", 1, 1, Integer.MAX_VALUE);
        if (problems.size() > before) {
            return null;
        }
        ServiceSpec spec = new ServiceSpec(name, kind, interval, timeout, e.params(SERVICE_KEYS), threshold);
        try {
            probers.require(kind).validate(spec);
        } catch (IllegalArgumentException ex) {
            problems.add(path + ": " + ex.getMessage());
            return null;
        }
        return spec;
    }

    private void addNotifier(String name, Object raw, Map<String, NotifierSpec> specs, List<String> problems) {
        String path = "notifiers." + name;
        if (specs.containsKey(name)) {
            problems.add(path + ": declared more than once");
            return;
        }
        if (!(raw instanceof Map<?, ?>)) {
            problems.add(path + ": must be a map");
            return;
        }
        Entry e = new Entry(path, asMap(raw), problems);
        if (!e.bool("enabled", true)) {
            LOGGER.info("Notifier " + name + " is disabled");
            return;
        }
        int before = problems.size();
        String kind = e.kind(notifiers.kinds(), NOTIFIER_KIND_ALIASES);
        RetryPolicy d = RetryPolicy.DEFAULT;
        // max_retries counts retries after the first attempt
        int retries = e.integer("max_retries", d.maxAttempts() - 1, 0, Integer.MAX_VALUE - 1);
        int maxAttempts = e.integer("max_attempts", retries + 1, 1, Integer.MAX_VALUE);
        Duration initialDelay = e.seconds("retry_delay", d.initialDelay());
        double backoff = e.decimal("retry_backoff", d.backoffMultiplier(), 1.0);
        Duration maxDelay = e.seconds("max_retry_delay", d.maxDelay());
        Duration timeout = e.positiveSeconds("timeout", d.deliveryTimeout());
        int maxConcurrent = e.integer("max_concurrent", 0, 0, Integer.MAX_VALUE);
        Set<HealthState> notifyOn = e.states("notify_on");
        String subject = e.string("subject", e.string("subject_template", null));
        String body = e.string("template", e.string("body_template", null));
        if (problems.size() > before) {
            return;
        }
        NotifierSpec spec = new NotifierSpec(name, kind, e.params(NOTIFIER_KEYS), subject, body,
                new RetryPolicy(maxAttempts, initialDelay, backoff, maxDelay, timeout), maxConcurrent, notifyOn);
        try {
            notifiers.require(kind).validate(spec);
        } catch (IllegalArgumentException ex) {
            problems.add(path + ": " + ex.getMessage());
            return;
        }
        specs.put(name, spec);
    }

    private static Map<String, Object> section(Map<String, Object> document, String key, List<String> problems) {
        Object raw = document.get(key);
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?>)) {
            problems.add(key + ": must be a map");
            return Map.of();
        }
        return asMap(raw);
    }

    private static Map<String, Object> asMap(Object raw) {
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<?, ?>) raw).forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static final class Entry {
        private final String path;
        private final Map<String, Object> values;
        private final List<String> problems;

        private Entry(String path, Map<String, Object> values, List<String> problems) {
            this.path = path;
            this.values = values;
            this.problems = problems;
        }

        String kind(Set<String> supported, Map<String, String> aliases) {
            Object raw = values.get("type");
            if (raw == null || raw.toString().isBlank()) {
                problems.add(path + ": type is required");
                return "";
            }
            String kind = raw.toString().trim().toLowerCase(Locale.ROOT);
            kind = aliases.getOrDefault(kind, kind);
            if (!supported.contains(kind)) {
                problems.add(path + ": unsupported type '" + raw + "' (supported: " + supported + ")");
            }
            return kind;
        }

        String string(String key, String fallback) {
            Object raw = values.get(key);
            return raw == null ? fallback : raw.toString();
        }

        boolean bool(String key, boolean fallback) {
            Object raw = values.get(key);
            if (raw == null) {
                return fallback;
            }
            if (raw instanceof Boolean value) {
                return value;
            }
            String text = raw.toString().trim().toLowerCase(Locale.ROOT);
            if (text.equals("true") || text.equals("false")) {
                return Boolean.parseBoolean(text);
            }
            problems.add(path + ": " + key + " must be true or false");
            return fallback;
        }

        int integer(String key, int fallback, int min, int max) {
            Object raw = values.get(key);
            if (raw == null) {
                return fallback;
            }
            try {
                int value = raw instanceof Number number ? number.intValue() : Integer.parseInt(raw.toString().trim());
                if (value < min || value > max) {
                    problems.add(path + ": " + key + " must be between " + min + " and " + max + ", was " + value);
                    return fallback;
                }
                return value;
            } catch (NumberFormatException ex) {
                problems.add(path + ": " + key + " must be an integer, was '" + raw + "'");
                return fallback;
            }
        }

        double decimal(String key, double fallback, double min) {
            Object raw = values.get(key);
            if (raw == null) {
                return fallback;
            }
            try {
                double value = raw instanceof Number number ? number.doubleValue() : Double.parseDouble(raw.toString().trim());
                if (value < min) {
                    problems.add(path + ": " + key + " must be >= " + min + ", was " + value);
                    return fallback;
                }
                return value;
            } catch (NumberFormatException ex) {
                problems.add(path + ": " + key + " must be a number, was '" + raw + "'");
                return fallback;
            }
        }

        Duration seconds(String key, Duration fallback) {
            Duration value = duration(key, fallback);
            if (value.isNegative()) {
                problems.add(path + ": " + key + " must not be negative");
                return fallback;
            }
            return value;
        }

        Duration positiveSeconds(String key, Duration fallback) {
            Duration value = duration(key, fallback);
            if (value.isNegative() || value.isZero()) {
                problems.add(path + ": " + key + " must be positive");
                return fallback;
            }
            return value;
        }

        private Duration duration(String key, Duration fallback) {
            Object raw = values.get(key);
            if (raw == null) {
                return fallback;
            }
            if (raw instanceof Number number) {
                return Duration.ofMillis(Math.round(number.doubleValue() * 1000));
            }
            String text = raw.toString().trim();
            try {
                return text.toUpperCase(Locale.ROOT).startsWith("P")
                        ? Duration.parse(text)
                        : Duration.ofMillis(Math.round(Double.parseDouble(text) * 1000));
            } catch (NumberFormatException | DateTimeParseException ex) {
                problems.add(path + ": " + key + " must be a number of seconds, was '" + raw + "'");
                return fallback;
            }
        }

        Set<HealthState> states(String key) {
            Object raw = values.get(key);
            if (raw == null) {
                return null;
            }
            List<?> items = raw instanceof List<?> list ? list : List.of(raw);
            Set<HealthState> states = EnumSet.noneOf(HealthState.class);
            for (Object item : items) {
                try {
                    states.add(HealthState.parse(String.valueOf(item)));
                } catch (IllegalArgumentException ex) {
                    problems.add(path + ": " + key + " has unknown state '" + item + "'");
                }
            }
            return states;
        }

        Map<String, Object> params(Set<String> reserved) {
            Map<String, Object> params = new LinkedHashMap<>();
            values.forEach((k, v) -> {
                if (!reserved.contains(k) && v != null) {
                    params.put(k, v);
                }
            });
            return params;
        }
    }
}
