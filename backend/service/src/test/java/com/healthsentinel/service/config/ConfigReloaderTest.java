package com.healthsentinel.service.config;

import com.healthsentinel.core.bus.EventBus;
import com.healthsentinel.core.events.ConfigRejected;
import com.healthsentinel.core.events.ConfigReloaded;
import com.healthsentinel.core.events.StateChanged;
import com.healthsentinel.core.model.HealthState;
import com.healthsentinel.core.model.MonitorConfig;
import com.healthsentinel.core.model.NotifierSpec;
import com.healthsentinel.core.model.ServiceSpec;
import com.healthsentinel.core.model.ServiceState;
import com.healthsentinel.probes.api.KindRegistry;
import com.healthsentinel.probes.api.Notifier;
import com.healthsentinel.probes.api.ProbeContext;
import com.healthsentinel.probes.api.Prober;
import com.healthsentinel.service.runtime.AlertDispatcher;
import com.healthsentinel.service.runtime.SchedulerService;
import com.healthsentinel.service.runtime.StateTracker;
import com.healthsentinel.service.support.Await;
import com.healthsentinel.service.support.EventCapture;
import com.healthsentinel.service.support.RecordingNotifier;
import com.healthsentinel.service.support.ScriptedProber;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigReloaderTest {
    private static final String TWO_SERVICES = """
            services:
              cache-a:
                type: scripted
                check_interval: 0.1
                target: cache-1
              user-db:
                type: scripted
                check_interval: 3600
                target: db-1
            notifiers:
              console:
                type: recording
            """;

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.systemUTC();
    private final EventBus bus = new EventBus();
    private final EventCapture events = new EventCapture(bus);
    private final ScriptedProber prober = new ScriptedProber();
    private final RecordingNotifier notifier = new RecordingNotifier("recording");
    private final ExecutorService blocking = Executors.newCachedThreadPool();
    private final StateTracker tracker = new StateTracker(bus, clock, 100, true);
    private final AlertDispatcher dispatcher =
            new AlertDispatcher(KindRegistry.notifiers(List.<Notifier>of(notifier)), bus, clock);
    private final SchedulerService scheduler = new SchedulerService(
            KindRegistry.probers(List.<Prober>of(prober)),
            new ProbeContext(HttpClient.newHttpClient(), clock, blocking),
            tracker, dispatcher, bus, 4);
    private Path configFile;
    private ConfigReloader reloader;

    @BeforeEach
    void setUp() throws IOException {
        configFile = tempDir.resolve("monitor.yaml");
        write(TWO_SERVICES);
        ConfigValidator validator = new ConfigValidator(
                KindRegistry.probers(List.<Prober>of(prober)),
                KindRegistry.notifiers(List.<Notifier>of(notifier)));
        reloader = new ConfigReloader(configFile, validator, scheduler, tracker, dispatcher, bus, clock);
    }

    @AfterEach
    void tearDown() {
        reloader.stop();
        scheduler.shutdown(Duration.ofMillis(200));
        dispatcher.shutdown(Duration.ofMillis(200));
        blocking.shutdownNow();
    }

    @Test
    void initialLoadSchedulesEveryServiceAndNotifier() {
        MonitorConfig config = reloader.loadInitial();

        assertEquals(List.of("cache-a", "user-db"),
                scheduler.scheduledServices().stream().map(ServiceSpec::name).toList());
        assertEquals(List.of("console"), dispatcher.notifiers().stream().map(NotifierSpec::name).toList());
        assertSame(config, reloader.current());
        Await.until(() -> tracker.allStates().size() == 2, "first probes");
    }

    @Test
    void unchangedFileIsNotReapplied() {
        reloader.loadInitial();

        assertFalse(reloader.reloadIfChanged());
        assertEquals(1, events.byType(ConfigReloaded.class).size());
    }

    @Test
    void intervalOnlyChangeKeepsStateWithoutSpuriousTransition() throws IOException {
        reloader.loadInitial();
        Await.until(() -> prober.calls("cache-a") >= 2, "cache-a probed");
        ServiceState stateBefore = tracker.currentState("cache-a").orElseThrow();

        write(TWO_SERVICES.replace("check_interval: 0.1", "check_interval: 0.2"));
        assertTrue(reloader.reloadIfChanged());

        assertEquals(Duration.ofMillis(200), reloader.current().services().get("cache-a").interval());
        assertEquals(stateBefore.lastTransitionAt(), tracker.currentState("cache-a").orElseThrow().lastTransitionAt());
        int callsAfterReload = prober.calls("cache-a");
        Await.until(() -> prober.calls("cache-a") >= callsAfterReload + 2, "probes at the new interval");
        assertTrue(events.byType(StateChanged.class).isEmpty());
        ConfigReloaded reloaded = events.byType(ConfigReloaded.class).get(events.byType(ConfigReloaded.class).size() - 1);
        assertEquals(List.of("cache-a"), reloaded.changedServices());
    }

    @Test
    void targetChangeClearsRecordedState() throws IOException {
        prober.script("user-db", HealthState.DOWN, "connection refused");
        reloader.loadInitial();
        Await.until(() -> events.byType(StateChanged.class).size() == 1, "initial failure alert");

        write(TWO_SERVICES.replace("target: db-1", "target: db-2"));
        assertTrue(reloader.reloadIfChanged());

        Await.until(() -> events.byType(StateChanged.class).size() == 2, "state re-established after replacement");
        List<StateChanged> changes = events.byType(StateChanged.class);
        assertNull(changes.get(1).transition().oldState());
        assertEquals("db-2", reloader.current().services().get("user-db").params().get("target"));
    }

    @Test
    void invalidEditIsRejectedAndRunningConfigKept() throws IOException {
        MonitorConfig initial = reloader.loadInitial();

        write(TWO_SERVICES.replace("type: recording", "type: pigeon"));

        assertFalse(reloader.reloadIfChanged());
        assertSame(initial, reloader.current());
        assertEquals(2, scheduler.scheduledServices().size());
        assertEquals(List.of("console"), dispatcher.notifiers().stream().map(NotifierSpec::name).toList());
        List<ConfigRejected> rejected = events.byType(ConfigRejected.class);
        assertEquals(1, rejected.size());
        assertTrue(rejected.get(0).problems().get(0).startsWith("notifiers.console: unsupported type 'pigeon'"));

        assertFalse(reloader.reloadIfChanged());
        assertEquals(1, events.byType(ConfigRejected.class).size());

        write(TWO_SERVICES.replace("check_interval: 3600", "check_interval: 1800"));
        assertTrue(reloader.reloadIfChanged());
    }

    @Test
    void syntaxErrorAndMissingFileAreRejected() throws IOException {
        MonitorConfig initial = reloader.loadInitial();

        write("services: [broken");
        assertFalse(reloader.reloadIfChanged());
        Files.delete(configFile);
        assertFalse(reloader.reloadIfChanged());
        assertFalse(reloader.reloadIfChanged());

        assertSame(initial, reloader.current());
        assertEquals(2, events.byType(ConfigRejected.class).size());
    }

    @Test
    void removedServiceIsUnscheduledAndAddedOneScheduled() throws IOException {
        reloader.loadInitial();

        write("""
                services:
                  cache-a:
                    type: scripted
                    check_interval: 0.1
                    target: cache-1
                  search:
                    type: scripted
                    check_interval: 3600
                """);
        assertTrue(reloader.reloadIfChanged());

        assertEquals(List.of("cache-a", "search"),
                scheduler.scheduledServices().stream().map(ServiceSpec::name).toList());
        assertTrue(dispatcher.notifiers().isEmpty());
        ConfigReloaded reloaded = events.byType(ConfigReloaded.class).get(events.byType(ConfigReloaded.class).size() - 1);
        assertEquals(List.of("search"), reloaded.addedServices());
        assertEquals(List.of("user-db"), reloaded.removedServices());
        assertEquals(List.of("console"), reloaded.changedNotifiers());
    }

    @Test
    void invalidInitialConfigurationFailsStartup() throws IOException {
        write("services:\n  x:\n    check_interval: 5\n");

        ConfigValidationException error = assertThrows(ConfigValidationException.class, reloader::loadInitial);

        assertEquals(List.of("services.x: type is required"), error.problems());
        assertTrue(scheduler.scheduledServices().isEmpty());
    }

    @Test
    void watcherPicksUpEdits() throws IOException {
        write(TWO_SERVICES.replace("services:", "global:\n  reload_interval: 0.1\nservices:"));
        reloader.loadInitial();
        reloader.start();

        write(TWO_SERVICES.replace("services:", "global:\n  reload_interval: 0.1\nservices:")
                .replace("check_interval: 3600", "check_interval: 1800"));

        Await.until(() -> reloader.current().services().get("user-db").interval().equals(Duration.ofMinutes(30)),
                "watcher to apply the edit");
    }

    private void write(String content) throws IOException {
        Files.writeString(configFile, content, StandardCharsets.UTF_8);
    }
}
