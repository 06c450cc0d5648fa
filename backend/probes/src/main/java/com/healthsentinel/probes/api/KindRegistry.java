package com.healthsentinel.probes.api;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

public final class KindRegistry<T> {
    private final String label;
    private final Map<String, T> byKind;

    private KindRegistry(String label, Collection<T> implementations, Function<T, String> kindOf) {
        this.label = label;
        Map<String, T> table = new TreeMap<>();
        for (T implementation : implementations) {
            String kind = normalize(kindOf.apply(implementation));
            if (table.putIfAbsent(kind, implementation) != null) {
                throw new IllegalArgumentException("Duplicate " + label + " kind: " + kind);
            }
        }
        this.byKind = Map.copyOf(table);
    }

    public static KindRegistry<Prober> probers(Collection<Prober> probers) {
        return new KindRegistry<>("prober", probers, Prober::kind);
    }

    public static KindRegistry<Notifier> notifiers(Collection<Notifier> notifiers) {
        return new KindRegistry<>("notifier", notifiers, Notifier::kind);
    }

    public Optional<T> find(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKind.get(normalize(kind)));
    }

    public T require(String kind) {
        return find(kind).orElseThrow(() -> new IllegalArgumentException(
                "Unsupported " + label + " kind '" + kind + "'; supported: " + kinds()));
    }

    public Set<String> kinds() {
        return new TreeSet<>(byKind.keySet());
    }

    private static String normalize(String kind) {
        return kind.trim().toLowerCase(Locale.ROOT);
    }
}
