package com.healthsentinel.service;

import com.healthsentinel.core.bus.EventBus;
import com.healthsentinel.core.events.StateChanged;
import com.healthsentinel.core.model.CheckOutcome;
import com.healthsentinel.core.model.DeliveryRecord;
import com.healthsentinel.core.model.GlobalSettings;
import com.healthsentinel.core.model.HealthState;
import com.healthsentinel.core.model.MonitorConfig;
import com.healthsentinel.core.model.StateTransition;
import com.healthsentinel.probes.api.KindRegistry;
import com.healthsentinel.probes.api.Notifier;
import com.healthsentinel.probes.api.ProbeContext;
import com.healthsentinel.probes.api.Prober;
import com.healthsentinel.probes.http.HttpProber;
import com.healthsentinel.probes.log.LogNotifier;
import com.healthsentinel.probes.tcp.TcpProber;
import com.healthsentinel.probes.webhook.WebhookNotifier;
import com.healthsentinel.service.api.StatusServer;
import com.healthsentinel.service.config.ConfigLoader;
import com.healthsentinel.service.config.ConfigReloader;
import com.healthsentinel.service.config.ConfigValidationException;
import com.healthsentinel.service.config.ConfigValidator;
import com.healthsentinel.service.config.LogLevels;
import com.healthsentinel.service.runtime.AlertDispatcher;
import com.healthsentinel.service.runtime.SchedulerService;
import com.healthsentinel.service.runtime.StateTracker;
import com.healthsentinel.service.store.JsonFileStateStore;
import com.healthsentinel.service.store.JsonlEventStore;
import com.healthsentinel.service.store.StateStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    static final Path DEFAULT_CONFIG = Path.of("config/monitor.yaml");
    static final int EXIT_OK = 0;
    static final int EXIT_UNHEALTHY = 1;
    static final int EXIT_CONFIG = 2;

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLoggingDefaults();
        Options options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: health-sentinel [--validate | --check-once | --test-alerts] [config-file]");
            System.exit(EXIT_CONFIG);
            return;
        }
        if (options.mode() == Mode.SERVE) {
            int code = serve(options.configPath());
            if (code != EXIT_OK) {
                System.exit(code);
            }
            return;
        }
        System.exit(runOneShot(options, System.out));
    }

    enum Mode {
        SERVE,
        VALIDATE,
        CHECK_ONCE,
        TEST_ALERTS
    }

    record Options(Mode mode, Path configPath) {
    }

    static Options parseArgs(String[] args) {
        Mode mode = Mode.SERVE;
        Path configPath = DEFAULT_CONFIG;
        boolean pathSeen = false;
        for (String arg : args) {
            Mode flag = switch (arg) {
                case "--validate" -> Mode.VALIDATE;
                case "--check-once" -> Mode.CHECK_ONCE;
                case "--test-alerts" -> Mode.TEST_ALERTS;
                default -> null;
            };
            if (flag != null) {
                if (mode != Mode.SERVE) {
                    throw new IllegalArgumentException("Only one of --validate, --check-once, --test-alerts may be given");
                }
                mode = flag;
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            } else if (pathSeen) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            } else {
                configPath = Path.of(arg);
                pathSeen = true;
            }
        }
        return new Options(mode, configPath);
    }

    static int runOneShot(Options options, PrintStream out) {
        Optional<MonitorConfig> loaded = loadOrReport(options.configPath(), out);
        if (loaded.isEmpty()) {
            return EXIT_CONFIG;
        }
        MonitorConfig config = loaded.get();
        Components components;
        applyLogLevel(config.global().logLevel());
        switch (options.mode()) {
            case VALIDATE -> {
                out.println("Configuration " + options.configPath() + " is valid: " + config.services().size()
                        + " service(s), " + config.notifiers().size() + " notifier(s)");
                return EXIT_OK;
            }
            case CHECK_ONCE -> {
                components = Components.build(config, new EventBus(), Clock.systemUTC());
                try {
                    List<CheckOutcome> outcomes = components.scheduler().runOnce(new ArrayList<>(config.services().values()));
                    boolean allUp = true;
                    for (CheckOutcome outcome : outcomes) {
                        allUp &= outcome.state() == HealthState.UP;
                        out.println(outcome.serviceName() + " [" + outcome.serviceKind() + "] " + outcome.state()
                                + " " + outcome.latencyMillis() + "ms"
                                + (outcome.error() == null ? "" : " - " + outcome.error()));
                    }
                    return allUp ? EXIT_OK : EXIT_UNHEALTHY;
                } finally {
                    components.shutdown(config.global());
                }
            }
            case TEST_ALERTS -> {
                Clock clock = Clock.systemUTC();
                components = Components.build(config, new EventBus(), clock);
                try {
                    components.dispatcher().applyNotifiers(config.notifiers());
                    StateTransition test = new StateTransition("health-sentinel-test", "test", HealthState.UP,
                            HealthState.DOWN, clock.instant(), 0, "test alert", Map.of());
                    List<DeliveryRecord> records = components.dispatcher().dispatch(test).join();
                    boolean allDelivered = true;
                    for (DeliveryRecord record : records) {
                        allDelivered &= record.success();
                        out.println(record.notifierName() + ": " + (record.success() ? "delivered" : "FAILED - " + record.lastError())
                                + " after " + record.attempts() + " attempt(s)");
                    }
                    return allDelivered ? EXIT_OK : EXIT_UNHEALTHY;
                } finally {
                    components.shutdown(config.global());
                }
            }
            default -> throw new IllegalStateException("Not a one-shot mode: " + options.mode());
        }
    }

    private static int serve(Path configPath) throws InterruptedException {
        Optional<MonitorConfig> loaded = loadOrReport(configPath, System.err);
        if (loaded.isEmpty()) {
            return EXIT_CONFIG;
        }
        MonitorConfig config = loaded.get();
        GlobalSettings global = config.global();
        applyLogLevel(global.logLevel());

        Clock clock = Clock.systemUTC();
        EventBus eventBus = new EventBus();
        Components components = Components.build(config, eventBus, clock);
        StateTracker tracker = components.tracker();

        StateStore stateStore = null;
        if (global.stateFile() != null) {
            stateStore = new JsonFileStateStore(Path.of(global.stateFile()));
            stateStore.load().ifPresent(snapshot -> tracker.restore(snapshot.retainServices(config.services().keySet())));
            StateStore store = stateStore;
            eventBus.subscribe(StateChanged.class, event -> store.save(tracker.snapshot()));
        }
        JsonlEventStore eventStore = null;
        if (global.eventLogFile() != null) {
            eventStore = new JsonlEventStore(Path.of(global.eventLogFile()));
            eventBus.subscribeAll(eventStore::append);
        }

        ConfigReloader reloader = new ConfigReloader(configPath, components.validator(), components.scheduler(),
                tracker, components.dispatcher(), eventBus, clock);
        try {
            reloader.loadInitial();
        } catch (ConfigValidationException | IllegalStateException e) {
            LOGGER.severe("Startup failed: " + e.getMessage());
            components.shutdown(global);
            return EXIT_CONFIG;
        }

        StatusServer statusServer = null;
        if (global.statusPort() > 0) {
            statusServer = new StatusServer(global.statusPort(), components.scheduler(), tracker,
                    components.dispatcher(), eventStore);
            statusServer.start();
        }
        reloader.start();
        LOGGER.info("Health Sentinel started with " + config.services().size() + " service(s) from " + configPath);

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        StatusServer server = statusServer;
        StateStore store = stateStore;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            reloader.stop();
            if (server != null) {
                server.stop();
            }
            components.shutdown(reloader.current().global());
            if (store != null) {
                store.save(tracker.snapshot());
            }
            shutdownLatch.countDown();
        }, "shutdown"));

        shutdownLatch.await();
        return EXIT_OK;
    }

    private static Optional<MonitorConfig> loadOrReport(Path configPath, PrintStream out) {
        try {
            return Optional.of(ConfigLoader.load(configPath, Components.validator(Components.httpClient(GlobalSettings.DEFAULTS))));
        } catch (ConfigValidationException e) {
            out.println("Configuration " + configPath + " is invalid:");
            e.problems().forEach(problem -> out.println("  - " + problem));
            return Optional.empty();
        } catch (IllegalStateException e) {
            out.println(e.getMessage() + (e.getCause() == null ? "" : ": " + e.getCause().getMessage()));
            return Optional.empty();
        }
    }

    private static void configureLoggingDefaults() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not read bundled logging.properties; using JVM defaults", e);
        }
    }

    static void applyLogLevel(String name) {
        Level level = LogLevels.parse(name);
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }

    private record Components(
            ConfigValidator validator,
            StateTracker tracker,
            AlertDispatcher dispatcher,
            SchedulerService scheduler,
            ExecutorService blockingExecutor
    ) {
        static Components build(MonitorConfig config, EventBus eventBus, Clock clock) {
            GlobalSettings global = config.global();
            HttpClient httpClient = httpClient(global);
            KindRegistry<Prober> probers = probers();
            KindRegistry<Notifier> notifiers = notifiers(httpClient);
            ExecutorService blocking = Executors.newCachedThreadPool(task -> {
                Thread thread = new Thread(task, "probe-io");
                thread.setDaemon(true);
                return thread;
            });
            StateTracker tracker = new StateTracker(eventBus, clock, global.historySize(), global.alertOnInitialFailure());
            AlertDispatcher dispatcher = new AlertDispatcher(notifiers, eventBus, clock);
            dispatcher.setSuppressRepeatWithin(global.suppressRepeatWithin());
            SchedulerService scheduler = new SchedulerService(probers, new ProbeContext(httpClient, clock, blocking),
                    tracker, dispatcher, eventBus, global.maxConcurrentProbes());
            return new Components(new ConfigValidator(probers, notifiers), tracker, dispatcher, scheduler, blocking);
        }

        static ConfigValidator validator(HttpClient httpClient) {
            return new ConfigValidator(probers(), notifiers(httpClient));
        }

        static HttpClient httpClient(GlobalSettings global) {
            return HttpClient.newBuilder()
                    .connectTimeout(global.defaultTimeout())
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .build();
        }

        static KindRegistry<Prober> probers() {
            return KindRegistry.probers(List.of(new HttpProber(), new TcpProber()));
        }

        static KindRegistry<Notifier> notifiers(HttpClient httpClient) {
            return KindRegistry.notifiers(List.of(new WebhookNotifier(httpClient), new LogNotifier()));
        }

        void shutdown(GlobalSettings global) {
            scheduler.shutdown(global.shutdownGrace());
            dispatcher.shutdown(global.shutdownGrace());
            blockingExecutor.shutdownNow();
        }
    }
}
