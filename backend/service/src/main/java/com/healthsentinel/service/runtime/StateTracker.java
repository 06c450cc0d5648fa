package com.healthsentinel.service.runtime;

import com.healthsentinel.core.bus.EventBus;
import com.healthsentinel.core.events.StateChanged;
import com.healthsentinel.core.model.CheckOutcome;
import com.healthsentinel.core.model.HealthState;
import com.healthsentinel.core.model.ServiceState;
import com.healthsentinel.core.model.ServiceStats;
import com.healthsentinel.core.model.StateTransition;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Owns the single live {@link ServiceState} per service and decides when an outcome is a transition.
 * <p>
 * Writes for one service are atomic through {@link ConcurrentHashMap#compute}; reads never block on them.
 * A transition is appended to the history and published only after the new state is recorded.
 */
public class StateTracker {
    private static final Logger LOGGER = Logger.getLogger(StateTracker.class.getName());

    private final ConcurrentHashMap<String, ServiceState> states = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ServiceStats> stats = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<StateTransition> history = new ConcurrentLinkedDeque<>();
    private final Object historyLock = new Object();
    private final EventBus eventBus;
    private final Clock clock;
    private volatile int historySize;
    private volatile boolean alertOnInitialFailure;
    private int historyCount;

    public StateTracker(EventBus eventBus, Clock clock, int historySize, boolean alertOnInitialFailure) {
        this.eventBus = eventBus;
        this.clock = clock;
        this.historySize = Math.max(1, historySize);
        this.alertOnInitialFailure = alertOnInitialFailure;
    }

    public Optional<StateTransition> update(CheckOutcome outcome) {
        return update(outcome, 1);
    }

    public Optional<StateTransition> update(CheckOutcome outcome, int failureThreshold) {
        AtomicReference<StateTransition> emitted = new AtomicReference<>();
        states.compute(outcome.serviceName(), (name, current) -> {
            ServiceState next = next(name, current, outcome, failureThreshold, emitted);
            boolean changed = emitted.get() != null;
            stats.compute(name, (ignored, previous) ->
                    (previous == null ? ServiceStats.empty(name) : previous).record(outcome, changed));
            return next;
        });

        StateTransition transition = emitted.get();
        if (transition == null) {
            return Optional.empty();
        }
        appendHistory(transition);
        LOGGER.info("State change: " + transition.serviceName() + " "
                + (transition.oldState() == null ? "(none)" : transition.oldState()) + " -> " + transition.newState()
                + (transition.error() == null ? "" : " (" + transition.error() + ")"));
        eventBus.publish(new StateChanged(clock.instant(), transition));
        return Optional.of(transition);
    }

    private ServiceState next(String name, ServiceState current, CheckOutcome outcome, int failureThreshold,
                              AtomicReference<StateTransition> emitted) {
        boolean unhealthy = !outcome.healthy();
        if (current == null) {
            if (unhealthy && alertOnInitialFailure) {
                emitted.set(StateTransition.from(null, outcome));
            }
            return new ServiceState(name, outcome.state(), outcome.timestamp(), outcome, unhealthy ? 1 : 0);
        }
        int failures = unhealthy ? current.consecutiveFailures() + 1 : 0;
        if (current.state() == outcome.state()) {
            return current.withOutcome(outcome, failures);
        }
        if (current.state() == HealthState.UP && failures < failureThreshold) {
            return current.withOutcome(outcome, failures);
        }
        emitted.set(StateTransition.from(current.state(), outcome));
        return new ServiceState(name, outcome.state(), outcome.timestamp(), outcome, failures);
    }

    public Optional<ServiceState> currentState(String serviceName) {
        return Optional.ofNullable(states.get(serviceName));
    }

    public Map<String, ServiceState> allStates() {
        return new TreeMap<>(states);
    }

    public ServiceStats stats(String serviceName) {
        return stats.getOrDefault(serviceName, ServiceStats.empty(serviceName));
    }

    // Newest first; null serviceName or since means no filter.
    public List<StateTransition> history(String serviceName, Instant since, int limit) {
        List<StateTransition> result = new ArrayList<>();
        for (StateTransition transition : history) {
            if (result.size() >= limit) {
                break;
            }
            if (serviceName != null && !serviceName.equals(transition.serviceName())) {
                continue;
            }
            if (since != null && transition.timestamp().isBefore(since)) {
                continue;
            }
            result.add(transition);
        }
        return result;
    }

    // The next outcome counts as a first observation; history is kept.
    public void clear(String serviceName) {
        states.remove(serviceName);
        stats.remove(serviceName);
    }

    public void restore(Snapshot snapshot) {
        for (ServiceState state : snapshot.states()) {
            states.put(state.serviceName(), state);
        }
        List<StateTransition> oldestFirst = new ArrayList<>(snapshot.recentTransitions());
        oldestFirst.sort(Comparator.comparing(StateTransition::timestamp));
        oldestFirst.forEach(this::appendHistory);
        LOGGER.info("Restored " + snapshot.states().size() + " service states and "
                + snapshot.recentTransitions().size() + " transitions");
    }

    public Snapshot snapshot() {
        return new Snapshot(clock.instant(), List.copyOf(allStates().values()), List.copyOf(history));
    }

    public void setAlertOnInitialFailure(boolean alertOnInitialFailure) {
        this.alertOnInitialFailure = alertOnInitialFailure;
    }

    public void setHistorySize(int historySize) {
        synchronized (historyLock) {
            this.historySize = Math.max(1, historySize);
            trimHistory();
        }
    }

    private void appendHistory(StateTransition transition) {
        synchronized (historyLock) {
            history.addFirst(transition);
            historyCount++;
            trimHistory();
        }
    }

    private void trimHistory() {
        while (historyCount > historySize) {
            history.pollLast();
            historyCount--;
        }
    }

    public record Snapshot(Instant savedAt, List<ServiceState> states, List<StateTransition> recentTransitions) {
        public Snapshot {
            states = states == null ? List.of() : List.copyOf(states);
            recentTransitions = recentTransitions == null ? List.of() : List.copyOf(recentTransitions);
        }

        public Snapshot retainServices(Set<String> serviceNames) {
            return new Snapshot(
                    savedAt,
                    states.stream().filter(state -> serviceNames.contains(state.serviceName())).toList(),
                    recentTransitions.stream().filter(t -> serviceNames.contains(t.serviceName())).toList()
            );
        }
    }
}
