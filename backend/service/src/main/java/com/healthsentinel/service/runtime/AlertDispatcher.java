package com.healthsentinel.service.runtime;

import com.healthsentinel.core.bus.EventBus;
import com.healthsentinel.core.events.AlertDelivered;
import com.healthsentinel.core.events.DeliveryAttempted;
import com.healthsentinel.core.model.DeliveryRecord;
import com.healthsentinel.core.model.NotifierSpec;
import com.healthsentinel.core.model.StateTransition;
import com.healthsentinel.core.util.TemplateRenderer;
import com.healthsentinel.probes.api.DeliveryResult;
import com.healthsentinel.probes.api.Failures;
import com.healthsentinel.probes.api.KindRegistry;
import com.healthsentinel.probes.api.Notifier;
import com.healthsentinel.probes.api.RenderedMessage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans a transition out to every configured notifier.
 * <p>
 * Transitions of one service are delivered in the order they were dispatched: the next one starts only
 * after every notifier finished with the previous one, retries included. Different services proceed in
 * parallel. Each notifier delivery runs on its own pool thread with its own {@link RetryLoop}, so a slow
 * or failing channel never holds back the others.
 */
public class AlertDispatcher {
    private static final Logger LOGGER = Logger.getLogger(AlertDispatcher.class.getName());
    private static final int DEFAULT_RECORD_CAPACITY = 500;

    private final KindRegistry<Notifier> notifierKinds;
    private final EventBus eventBus;
    private final Clock clock;
    private final Sleeper sleeper;
    private final int recordCapacity;
    private final ExecutorService deliveryExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("delivery"));
    private final ConcurrentHashMap<String, CompletableFuture<Void>> serviceTails = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Instant> lastAlerted = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<DeliveryRecord> recent = new ConcurrentLinkedDeque<>();
    private final Object recentLock = new Object();
    private int recentCount;
    private volatile List<NotifierSlot> slots = List.of();
    private volatile Duration suppressRepeatWithin = Duration.ZERO;

    public AlertDispatcher(KindRegistry<Notifier> notifierKinds, EventBus eventBus, Clock clock) {
        this(notifierKinds, eventBus, clock, Sleeper.SYSTEM, DEFAULT_RECORD_CAPACITY);
    }

    AlertDispatcher(KindRegistry<Notifier> notifierKinds, EventBus eventBus, Clock clock, Sleeper sleeper, int recordCapacity) {
        this.notifierKinds = notifierKinds;
        this.eventBus = eventBus;
        this.clock = clock;
        this.sleeper = sleeper;
        this.recordCapacity = recordCapacity;
    }

    // Started deliveries keep their configuration; an unknown kind leaves the old set active.
    public synchronized void applyNotifiers(Map<String, NotifierSpec> specs) {
        Map<String, NotifierSlot> previous = new HashMap<>();
        for (NotifierSlot slot : slots) {
            previous.put(slot.spec().name(), slot);
        }
        List<NotifierSlot> next = new ArrayList<>();
        for (NotifierSpec spec : specs.values()) {
            NotifierSlot existing = previous.get(spec.name());
            if (existing != null && existing.spec().equals(spec)) {
                next.add(existing);
                continue;
            }
            Semaphore permits = spec.maxConcurrentDeliveries() > 0
                    ? new Semaphore(spec.maxConcurrentDeliveries(), true)
                    : null;
            next.add(new NotifierSlot(spec, notifierKinds.require(spec.kind()), permits));
        }
        slots = List.copyOf(next);
        LOGGER.info("Active notifiers: " + new TreeSet<>(specs.keySet()));
    }

    public List<NotifierSpec> notifiers() {
        return slots.stream().map(NotifierSlot::spec).toList();
    }

    // Zero turns repeat suppression off.
    public void setSuppressRepeatWithin(Duration window) {
        this.suppressRepeatWithin = window == null ? Duration.ZERO : window;
    }

    public CompletableFuture<List<DeliveryRecord>> dispatch(StateTransition transition) {
        if (suppressed(transition)) {
            LOGGER.fine("Suppressed repeat alert for " + transition.serviceName() + " " + transition.newState());
            return CompletableFuture.completedFuture(List.of());
        }
        AtomicReference<CompletableFuture<List<DeliveryRecord>>> run = new AtomicReference<>();
        CompletableFuture<Void> tail = serviceTails.compute(transition.serviceName(), (name, previous) -> {
            CompletableFuture<Void> predecessor = previous == null ? CompletableFuture.completedFuture(null) : previous;
            run.set(predecessor.thenCompose(ignored -> deliverAll(transition, slots)));
            return run.get().handle((records, error) -> null);
        });
        tail.whenComplete((ignored, error) -> serviceTails.remove(transition.serviceName(), tail));
        return run.get();
    }

    public List<DeliveryRecord> recentDeliveries(int limit) {
        List<DeliveryRecord> result = new ArrayList<>();
        for (DeliveryRecord record : recent) {
            if (result.size() >= limit) {
                break;
            }
            result.add(record);
        }
        return result;
    }

    public void shutdown(Duration grace) {
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning("Deliveries still running after " + grace + "; cancelling");
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deliveryExecutor.shutdownNow();
        }
    }

    private boolean suppressed(StateTransition transition) {
        Duration window = suppressRepeatWithin;
        if (window.isZero() || window.isNegative()) {
            return false;
        }
        String key = transition.serviceName() + "|" + transition.newState();
        AtomicBoolean suppressed = new AtomicBoolean();
        lastAlerted.compute(key, (ignored, last) -> {
            if (last != null && transition.timestamp().isBefore(last.plus(window))) {
                suppressed.set(true);
                return last;
            }
            return transition.timestamp();
        });
        return suppressed.get();
    }

    private CompletableFuture<List<DeliveryRecord>> deliverAll(StateTransition transition, List<NotifierSlot> configured) {
        List<CompletableFuture<DeliveryRecord>> deliveries = new ArrayList<>();
        for (NotifierSlot slot : configured) {
            if (!slot.spec().triggersOn(transition.newState())) {
                continue;
            }
            try {
                deliveries.add(CompletableFuture.supplyAsync(() -> deliver(slot, transition), deliveryExecutor));
            } catch (RejectedExecutionException e) {
                deliveries.add(CompletableFuture.completedFuture(
                        finish(slot, transition, new RetryLoop.Result(RetryLoop.Phase.ABANDONED, 0, "dispatcher stopped"))));
            }
        }
        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> deliveries.stream().map(CompletableFuture::join).toList());
    }

    private DeliveryRecord deliver(NotifierSlot slot, StateTransition transition) {
        NotifierSpec spec = slot.spec();
        String subjectTemplate = spec.subjectTemplate() == null ? NotifierSpec.DEFAULT_SUBJECT : spec.subjectTemplate();
        RenderedMessage message = new RenderedMessage(
                TemplateRenderer.render(subjectTemplate, transition),
                TemplateRenderer.render(spec.bodyTemplate(), transition),
                transition
        );
        RetryLoop.Result result = new RetryLoop(spec.retry(), sleeper)
                .run(attempt -> attemptOnce(slot, message, attempt));
        return finish(slot, transition, result);
    }

    private DeliveryResult attemptOnce(NotifierSlot slot, RenderedMessage message, int attempt) throws InterruptedException {
        NotifierSpec spec = slot.spec();
        Duration timeout = spec.retry().deliveryTimeout();
        Semaphore permits = slot.permits();
        if (permits != null) {
            permits.acquire();
        }
        DeliveryResult result;
        try {
            result = callNotifier(slot, message, timeout);
        } finally {
            if (permits != null) {
                permits.release();
            }
        }
        eventBus.publish(new DeliveryAttempted(clock.instant(), spec.name(), message.transition().serviceName(),
                attempt, result.success(), result.reason()));
        if (!result.success()) {
            LOGGER.warning("Delivery attempt " + attempt + "/" + spec.retry().maxAttempts() + " via " + spec.name()
                    + " for " + message.transition().serviceName() + " failed: " + result.reason());
        }
        return result;
    }

    private DeliveryResult callNotifier(NotifierSlot slot, RenderedMessage message, Duration timeout)
            throws InterruptedException {
        CompletableFuture<DeliveryResult> future;
        try {
            future = slot.notifier().deliver(message, slot.spec(), timeout);
        } catch (RuntimeException e) {
            return DeliveryResult.failed(Failures.describe(e));
        }
        try {
            DeliveryResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result == null ? DeliveryResult.failed("notifier returned no result") : result;
        } catch (TimeoutException e) {
            future.cancel(true);
            return DeliveryResult.failed(Failures.TIMEOUT);
        } catch (ExecutionException e) {
            return DeliveryResult.failed(Failures.describe(e));
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private DeliveryRecord finish(NotifierSlot slot, StateTransition transition, RetryLoop.Result result) {
        DeliveryRecord record = new DeliveryRecord(
                slot.spec().name(),
                transition.serviceName(),
                transition.newState(),
                result.success(),
                result.attempts(),
                result.lastError(),
                clock.instant()
        );
        synchronized (recentLock) {
            recent.addFirst(record);
            recentCount++;
            while (recentCount > recordCapacity) {
                recent.pollLast();
                recentCount--;
            }
        }
        if (result.success()) {
            LOGGER.info("Alert for " + transition.serviceName() + " -> " + transition.newState()
                    + " delivered via " + slot.spec().name() + " after " + result.attempts() + " attempt(s)");
        } else {
            LOGGER.log(Level.SEVERE, "Alert for " + transition.serviceName() + " -> " + transition.newState()
                    + " not delivered via " + slot.spec().name() + " after " + result.attempts()
                    + " attempt(s): " + result.lastError());
        }
        eventBus.publish(new AlertDelivered(clock.instant(), record));
        return record;
    }

    private record NotifierSlot(NotifierSpec spec, Notifier notifier, Semaphore permits) {
    }
}
