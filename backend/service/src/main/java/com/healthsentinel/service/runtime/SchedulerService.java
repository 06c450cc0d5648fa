package com.healthsentinel.service.runtime;

import com.healthsentinel.core.bus.EventBus;
import com.healthsentinel.core.events.AlertRaised;
import com.healthsentinel.core.events.ProbeCompleted;
import com.healthsentinel.core.events.ProbeSkipped;
import com.healthsentinel.core.model.CheckOutcome;
import com.healthsentinel.core.model.ServiceSpec;
import com.healthsentinel.probes.api.Failures;
import com.healthsentinel.probes.api.KindRegistry;
import com.healthsentinel.probes.api.ProbeContext;
import com.healthsentinel.probes.api.Prober;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one periodic probe per registered service and feeds the outcomes to the {@link StateTracker}.
 * <p>
 * Timers fire on a single thread; probes run on a separate pool. At most {@code maxConcurrentProbes}
 * probes are outstanding at once: a tick that finds the ceiling reached queues its service (FIFO) and the
 * probe starts as soon as a slot frees. A tick for a service whose previous probe has not finished is
 * skipped. Each probe is bounded by its service timeout and reported {@code DOWN "timeout"} when it
 * overruns.
 */
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final KindRegistry<Prober> probers;
    private final ProbeContext context;
    private final StateTracker tracker;
    private final AlertDispatcher dispatcher;
    private final EventBus eventBus;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor =
            Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("probe-timer"));
    private final ExecutorService probeExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("probe"));

    private final Object lock = new Object();
    private final Map<String, ServiceEntry> entries = new HashMap<>();
    private final Deque<ServiceEntry> deferred = new ArrayDeque<>();
    private int inFlight;
    private int maxConcurrentProbes;
    private boolean shuttingDown;

    public SchedulerService(KindRegistry<Prober> probers, ProbeContext context, StateTracker tracker,
                            AlertDispatcher dispatcher, EventBus eventBus, int maxConcurrentProbes) {
        this(probers, context, tracker, dispatcher, eventBus, maxConcurrentProbes, 100);
    }

    SchedulerService(KindRegistry<Prober> probers, ProbeContext context, StateTracker tracker,
                     AlertDispatcher dispatcher, EventBus eventBus, int maxConcurrentProbes, long minIntervalMillis) {
        this.probers = probers;
        this.context = context;
        this.tracker = tracker;
        this.dispatcher = dispatcher;
        this.eventBus = eventBus;
        this.maxConcurrentProbes = Math.max(1, maxConcurrentProbes);
        this.minIntervalMillis = minIntervalMillis;
    }

    public void schedule(ServiceSpec spec) {
        probers.require(spec.kind());
        synchronized (lock) {
            if (shuttingDown) {
                throw new IllegalStateException("Scheduler is shut down");
            }
            if (entries.containsKey(spec.name())) {
                throw new DuplicateServiceException(spec.name());
            }
            ServiceEntry entry = new ServiceEntry(spec);
            entries.put(spec.name(), entry);
            entry.timer = startTimer(entry, 0);
        }
        LOGGER.info("Scheduled " + spec.name() + " (" + spec.kind() + ") every " + spec.interval().toMillis() + "ms");
    }

    // Recorded state is left alone; an in-flight probe is cancelled and its result dropped.
    public void unschedule(String serviceName) {
        ServiceEntry entry;
        synchronized (lock) {
            entry = entries.remove(serviceName);
            if (entry == null) {
                return;
            }
            entry.timer.cancel(false);
            if (deferred.remove(entry)) {
                entry.outstanding = false;
            }
        }
        synchronized (entry) {
            entry.active = false;
        }
        CompletableFuture<CheckOutcome> current = entry.current;
        if (current != null) {
            current.cancel(true);
        }
        LOGGER.info("Unscheduled " + serviceName);
    }

    public void reschedule(ServiceSpec spec) {
        probers.require(spec.kind());
        synchronized (lock) {
            ServiceEntry entry = entries.get(spec.name());
            if (entry == null) {
                throw new UnknownServiceException(spec.name());
            }
            ServiceSpec previous = entry.spec;
            entry.spec = spec;
            if (!previous.interval().equals(spec.interval())) {
                entry.timer.cancel(false);
                entry.timer = startTimer(entry, intervalMillis(spec));
            }
        }
        LOGGER.info("Rescheduled " + spec.name() + " every " + spec.interval().toMillis() + "ms");
    }

    public void setMaxConcurrentProbes(int maxConcurrentProbes) {
        List<ServiceEntry> released = new ArrayList<>();
        synchronized (lock) {
            this.maxConcurrentProbes = Math.max(1, maxConcurrentProbes);
            ServiceEntry next;
            while (inFlight < this.maxConcurrentProbes && (next = deferred.pollFirst()) != null) {
                inFlight++;
                released.add(next);
            }
        }
        released.forEach(this::launch);
    }

    public List<ServiceSpec> scheduledServices() {
        synchronized (lock) {
            return entries.values().stream()
                    .map(entry -> entry.spec)
                    .sorted((a, b) -> a.name().compareTo(b.name()))
                    .toList();
        }
    }

    public int inFlightCount() {
        synchronized (lock) {
            return inFlight;
        }
    }

    public List<ProbeTiming> probeTimings() {
        synchronized (lock) {
            return entries.values().stream()
                    .map(entry -> ProbeTiming.of(entry.spec, entry.lastProbeAt))
                    .sorted((a, b) -> a.serviceName().compareTo(b.serviceName()))
                    .toList();
        }
    }

    public int deferredCount() {
        synchronized (lock) {
            return deferred.size();
        }
    }

    public List<CheckOutcome> runOnceAll() {
        return runOnce(scheduledServices());
    }

    // Outside the schedule; recorded state is not touched.
    public List<CheckOutcome> runOnce(List<ServiceSpec> specs) {
        List<CompletableFuture<CheckOutcome>> probes = new ArrayList<>();
        for (ServiceSpec spec : specs) {
            probes.add(CompletableFuture.supplyAsync(() -> startProbe(spec), probeExecutor)
                    .thenCompose(probe -> bounded(spec, probe, context.clock().instant())));
        }
        return probes.stream().map(CompletableFuture::join).toList();
    }

    public void shutdown(Duration grace) {
        List<ServiceEntry> remaining;
        synchronized (lock) {
            shuttingDown = true;
            for (ServiceEntry entry : entries.values()) {
                entry.timer.cancel(false);
            }
            for (ServiceEntry entry : deferred) {
                entry.outstanding = false;
            }
            deferred.clear();
            long deadline = System.nanoTime() + grace.toNanos();
            while (inFlight > 0) {
                long waitMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (waitMillis <= 0) {
                    break;
                }
                try {
                    lock.wait(waitMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            remaining = new ArrayList<>(entries.values());
        }
        for (ServiceEntry entry : remaining) {
            synchronized (entry) {
                entry.active = false;
            }
            CompletableFuture<CheckOutcome> current = entry.current;
            if (current != null) {
                current.cancel(true);
            }
        }
        timerExecutor.shutdownNow();
        probeExecutor.shutdown();
        try {
            if (!probeExecutor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                probeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            probeExecutor.shutdownNow();
        }
        LOGGER.info("Scheduler stopped");
    }

    private ScheduledFuture<?> startTimer(ServiceEntry entry, long initialDelayMillis) {
        return timerExecutor.scheduleAtFixedRate(
                () -> tick(entry),
                initialDelayMillis,
                intervalMillis(entry.spec),
                TimeUnit.MILLISECONDS
        );
    }

    private long intervalMillis(ServiceSpec spec) {
        return Math.max(minIntervalMillis, spec.interval().toMillis());
    }

    private void tick(ServiceEntry entry) {
        boolean launch;
        synchronized (lock) {
            if (!entry.active || shuttingDown) {
                return;
            }
            if (entry.outstanding) {
                launch = false;
            } else {
                entry.outstanding = true;
                if (inFlight < maxConcurrentProbes) {
                    inFlight++;
                    launch = true;
                } else {
                    deferred.addLast(entry);
                    LOGGER.fine("Probe ceiling reached; deferring " + entry.spec.name());
                    return;
                }
            }
        }
        if (launch) {
            launch(entry);
            return;
        }
        String name = entry.spec.name();
        LOGGER.warning("Skipping probe of " + name + ": previous probe still outstanding");
        eventBus.publish(new ProbeSkipped(context.clock().instant(), name, "previous probe still outstanding"));
    }

    private void launch(ServiceEntry entry) {
        try {
            probeExecutor.execute(() -> runProbe(entry));
        } catch (RejectedExecutionException e) {
            LOGGER.fine("Probe executor stopped; dropping probe of " + entry.spec.name());
            release(entry);
        }
    }

    private void runProbe(ServiceEntry entry) {
        ServiceSpec spec = entry.spec;
        Instant startedAt = context.clock().instant();
        CompletableFuture<CheckOutcome> probe = startProbe(spec);
        entry.current = probe;
        if (!entry.active) {
            probe.cancel(true);
        }
        bounded(spec, probe, startedAt).whenComplete((outcome, error) -> complete(entry, spec, outcome));
    }

    private CompletableFuture<CheckOutcome> startProbe(ServiceSpec spec) {
        try {
            CompletableFuture<CheckOutcome> probe = probers.require(spec.kind()).probe(spec, context);
            return probe == null ? CompletableFuture.failedFuture(new IllegalStateException("prober returned no result")) : probe;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<CheckOutcome> bounded(ServiceSpec spec, CompletableFuture<CheckOutcome> probe, Instant startedAt) {
        return probe.orTimeout(spec.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((outcome, error) -> {
                    if (error == null && outcome != null) {
                        return outcome;
                    }
                    Instant now = context.clock().instant();
                    long latencyMillis = Math.max(0, Duration.between(startedAt, now).toMillis());
                    String reason = error == null ? "prober returned no outcome" : Failures.describe(error);
                    return CheckOutcome.down(spec.name(), spec.kind(), latencyMillis, reason, now);
                });
    }

    private void complete(ServiceEntry entry, ServiceSpec spec, CheckOutcome outcome) {
        entry.current = null;
        try {
            if (outcome != null) {
                apply(entry, spec, outcome);
            }
        } finally {
            release(entry);
        }
    }

    // Runs before the slot is released, so the next probe of the service cannot overtake this outcome.
    private void apply(ServiceEntry entry, ServiceSpec spec, CheckOutcome outcome) {
        try {
            eventBus.publish(new ProbeCompleted(outcome.timestamp(), outcome.serviceName(), outcome.state(),
                    outcome.latencyMillis(), outcome.error()));
            synchronized (entry) {
                if (!entry.active) {
                    LOGGER.fine("Discarding late result for unscheduled " + spec.name());
                    return;
                }
                entry.lastProbeAt = outcome.timestamp();
                tracker.update(outcome, entry.spec.failureThreshold()).ifPresent(dispatcher::dispatch);
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Handling probe outcome of " + spec.name() + " failed", e);
            eventBus.publish(new AlertRaised(
                    context.clock().instant(),
                    "scheduler",
                    "Probe outcome handling failed: " + spec.name() + " - " + e.getMessage(),
                    Map.of("service", spec.name())
            ));
        }
    }

    private void release(ServiceEntry entry) {
        ServiceEntry next;
        synchronized (lock) {
            entry.outstanding = false;
            inFlight--;
            next = shuttingDown ? null : deferred.pollFirst();
            if (next != null) {
                inFlight++;
            }
            lock.notifyAll();
        }
        if (next != null) {
            launch(next);
        }
    }

    private static final class ServiceEntry {
        private volatile ServiceSpec spec;
        private volatile boolean active = true;
        private volatile CompletableFuture<CheckOutcome> current;
        private volatile Instant lastProbeAt;
        private ScheduledFuture<?> timer;
        private boolean outstanding;

        private ServiceEntry(ServiceSpec spec) {
            this.spec = spec;
        }
    }
}
