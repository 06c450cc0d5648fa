package com.healthsentinel.service.config;

import com.healthsentinel.core.model.MonitorConfig;
import com.healthsentinel.core.model.NotifierSpec;
import com.healthsentinel.core.model.ServiceSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * What changed between two configurations.
 * <p>
 * A service whose {@code kind} or {@code params} changed is <em>replaced</em>: it probes something
 * different, so its recorded state is dropped. A service where only the interval, timeout or failure
 * threshold changed is <em>rescheduled</em> and keeps its state.
 */
public record ConfigDiff(
        List<ServiceSpec> addedServices,
        List<String> removedServices,
        List<ServiceSpec> rescheduledServices,
        List<ServiceSpec> replacedServices,
        List<NotifierSpec> addedNotifiers,
        List<String> removedNotifiers,
        List<NotifierSpec> replacedNotifiers,
        boolean globalChanged
) {
    public static ConfigDiff between(MonitorConfig previous, MonitorConfig next) {
        List<ServiceSpec> added = new ArrayList<>();
        List<ServiceSpec> rescheduled = new ArrayList<>();
        List<ServiceSpec> replaced = new ArrayList<>();
        for (ServiceSpec spec : next.services().values()) {
            ServiceSpec old = previous.services().get(spec.name());
            if (old == null) {
                added.add(spec);
            } else if (!old.sameProbeTarget(spec)) {
                replaced.add(spec);
            } else if (!old.equals(spec)) {
                rescheduled.add(spec);
            }
        }

        List<NotifierSpec> addedNotifiers = new ArrayList<>();
        List<NotifierSpec> replacedNotifiers = new ArrayList<>();
        for (NotifierSpec spec : next.notifiers().values()) {
            NotifierSpec old = previous.notifiers().get(spec.name());
            if (old == null) {
                addedNotifiers.add(spec);
            } else if (!old.equals(spec)) {
                replacedNotifiers.add(spec);
            }
        }

        return new ConfigDiff(
                List.copyOf(added),
                removedKeys(previous.services(), next.services()),
                List.copyOf(rescheduled),
                List.copyOf(replaced),
                List.copyOf(addedNotifiers),
                removedKeys(previous.notifiers(), next.notifiers()),
                List.copyOf(replacedNotifiers),
                !previous.global().equals(next.global())
        );
    }

    public boolean isEmpty() {
        return addedServices.isEmpty() && removedServices.isEmpty() && rescheduledServices.isEmpty()
                && replacedServices.isEmpty() && !notifiersChanged() && !globalChanged;
    }

    public boolean notifiersChanged() {
        return !addedNotifiers.isEmpty() || !removedNotifiers.isEmpty() || !replacedNotifiers.isEmpty();
    }

    public List<String> changedServiceNames() {
        List<String> names = new ArrayList<>();
        rescheduledServices.forEach(spec -> names.add(spec.name()));
        replacedServices.forEach(spec -> names.add(spec.name()));
        return names;
    }

    public List<String> changedNotifierNames() {
        List<String> names = new ArrayList<>();
        addedNotifiers.forEach(spec -> names.add(spec.name()));
        removedNotifiers.forEach(names::add);
        replacedNotifiers.forEach(spec -> names.add(spec.name()));
        return names;
    }

    private static List<String> removedKeys(Map<String, ?> previous, Map<String, ?> next) {
        return previous.keySet().stream().filter(name -> !next.containsKey(name)).toList();
    }
}
