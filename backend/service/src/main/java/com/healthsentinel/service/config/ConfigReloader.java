package com.healthsentinel.service.config;

import com.healthsentinel.core.bus.EventBus;
import com.healthsentinel.core.events.ConfigRejected;
import com.healthsentinel.core.events.ConfigReloaded;
import com.healthsentinel.core.model.GlobalSettings;
import com.healthsentinel.core.model.MonitorConfig;
import com.healthsentinel.core.model.ServiceSpec;
import com.healthsentinel.core.util.HashingUtils;
import com.healthsentinel.service.runtime.AlertDispatcher;
import com.healthsentinel.service.runtime.SchedulerService;
import com.healthsentinel.service.runtime.StateTracker;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Watches the configuration file and applies changes to the running scheduler, tracker and dispatcher.
 * <p>
 * A changed file (by content hash) is loaded and validated in full before anything is touched, so an
 * invalid edit leaves the running configuration exactly as it was. Applies are serialized.
 */
public class ConfigReloader {
    private static final Logger LOGGER = Logger.getLogger(ConfigReloader.class.getName());
    private static final String UNREADABLE = "unreadable";

    private final Path configPath;
    private final ConfigValidator validator;
    private final SchedulerService scheduler;
    private final StateTracker tracker;
    private final AlertDispatcher dispatcher;
    private final EventBus eventBus;
    private final Clock clock;
    private final ReentrantLock applyLock = new ReentrantLock();
    private volatile MonitorConfig current = MonitorConfig.empty();
    private volatile String currentHash;
    private ScheduledExecutorService watcher;
    private ScheduledFuture<?> watchTask;

    public ConfigReloader(Path configPath, ConfigValidator validator, SchedulerService scheduler, StateTracker tracker,
                          AlertDispatcher dispatcher, EventBus eventBus, Clock clock) {
        this.configPath = configPath;
        this.validator = validator;
        this.scheduler = scheduler;
        this.tracker = tracker;
        this.dispatcher = dispatcher;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public MonitorConfig current() {
        return current;
    }

    public MonitorConfig loadInitial() {
        byte[] content = ConfigLoader.readBytes(configPath);
        MonitorConfig initial = validator.validate(ConfigLoader.parse(content, configPath));
        apply(initial);
        currentHash = HashingUtils.sha256(content);
        return initial;
    }

    public boolean reloadIfChanged() {
        byte[] content;
        try {
            content = ConfigLoader.readBytes(configPath);
        } catch (IllegalStateException e) {
            if (!UNREADABLE.equals(currentHash)) {
                reject(List.of(rootMessage(e)));
            }
            currentHash = UNREADABLE;
            return false;
        }
        String hash = HashingUtils.sha256(content);
        if (hash.equals(currentHash)) {
            return false;
        }
        MonitorConfig next;
        try {
            next = validator.validate(ConfigLoader.parse(content, configPath));
        } catch (ConfigValidationException e) {
            currentHash = hash;
            reject(e.problems());
            return false;
        } catch (IllegalStateException e) {
            currentHash = hash;
            reject(List.of(rootMessage(e)));
            return false;
        }
        apply(next);
        currentHash = hash;
        return true;
    }

    // Order: removals, replacements, cadence changes, additions, notifiers, global settings.
    public ConfigDiff apply(MonitorConfig next) {
        applyLock.lock();
        try {
            ConfigDiff diff = ConfigDiff.between(current, next);
            if (diff.isEmpty()) {
                current = next;
                return diff;
            }
            diff.removedServices().forEach(scheduler::unschedule);
            for (ServiceSpec spec : diff.replacedServices()) {
                scheduler.unschedule(spec.name());
                tracker.clear(spec.name());
                scheduler.schedule(spec);
            }
            diff.rescheduledServices().forEach(scheduler::reschedule);
            diff.addedServices().forEach(scheduler::schedule);
            if (diff.notifiersChanged()) {
                dispatcher.applyNotifiers(next.notifiers());
            }
            if (diff.globalChanged()) {
                applyGlobal(next.global());
            }
            current = next;
            LOGGER.info("Configuration applied: +" + diff.addedServices().size() + " -" + diff.removedServices().size()
                    + " ~" + diff.changedServiceNames().size() + " services, " + diff.changedNotifierNames().size()
                    + " notifier change(s)");
            eventBus.publish(new ConfigReloaded(
                    clock.instant(),
                    diff.addedServices().stream().map(ServiceSpec::name).toList(),
                    diff.removedServices(),
                    diff.changedServiceNames(),
                    diff.changedNotifierNames()
            ));
            return diff;
        } finally {
            applyLock.unlock();
        }
    }

    public synchronized void start() {
        if (watcher != null) {
            return;
        }
        long periodMillis = Math.max(100, current.global().reloadInterval().toMillis());
        watcher = Executors.newSingleThreadScheduledExecutor(task -> {
            Thread thread = new Thread(task, "config-watcher");
            thread.setDaemon(true);
            return thread;
        });
        watchTask = watcher.scheduleWithFixedDelay(this::pollSafely, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        LOGGER.info("Watching " + configPath + " every " + periodMillis + "ms");
    }

    public synchronized void stop() {
        if (watcher == null) {
            return;
        }
        watchTask.cancel(false);
        watcher.shutdownNow();
        watcher = null;
        watchTask = null;
    }

    private void pollSafely() {
        try {
            reloadIfChanged();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Applying configuration from " + configPath + " failed", e);
        }
    }

    private void applyGlobal(GlobalSettings global) {
        scheduler.setMaxConcurrentProbes(global.maxConcurrentProbes());
        tracker.setAlertOnInitialFailure(global.alertOnInitialFailure());
        tracker.setHistorySize(global.historySize());
        dispatcher.setSuppressRepeatWithin(global.suppressRepeatWithin());
    }

    private void reject(List<String> problems) {
        LOGGER.severe("Rejected configuration " + configPath + "; keeping the running configuration. Problems: "
                + String.join("; ", problems));
        eventBus.publish(new ConfigRejected(clock.instant(), configPath.toString(), problems));
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String detail = current == error ? "" : ": " + current.getMessage();
        return error.getMessage() + detail;
    }
}
