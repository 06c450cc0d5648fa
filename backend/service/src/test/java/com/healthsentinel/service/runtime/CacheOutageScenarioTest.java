package com.healthsentinel.service.runtime;

import com.healthsentinel.core.bus.EventBus;
import com.healthsentinel.core.events.StateChanged;
import com.healthsentinel.core.model.DeliveryRecord;
import com.healthsentinel.core.model.HealthState;
import com.healthsentinel.core.model.NotifierSpec;
import com.healthsentinel.core.model.RetryPolicy;
import com.healthsentinel.core.model.ServiceSpec;
import com.healthsentinel.core.model.StateTransition;
import com.healthsentinel.probes.api.KindRegistry;
import com.healthsentinel.probes.api.Notifier;
import com.healthsentinel.probes.api.ProbeContext;
import com.healthsentinel.probes.api.Prober;
import com.healthsentinel.service.support.Await;
import com.healthsentinel.service.support.EventCapture;
import com.healthsentinel.service.support.RecordingNotifier;
import com.healthsentinel.service.support.ScriptedProber;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A cache that answers three probes and then starts refusing connections raises exactly one alert per
 * notifier, no matter how many failing probes follow.
 */
class CacheOutageScenarioTest {
    private final Clock clock = Clock.systemUTC();
    private final EventBus bus = new EventBus();
    private final EventCapture events = new EventCapture(bus);
    private final ExecutorService blocking = Executors.newCachedThreadPool();
    private final ScriptedProber prober = new ScriptedProber();
    private final RecordingNotifier notifier = new RecordingNotifier("recording");
    private final StateTracker tracker = new StateTracker(bus, clock, 100, true);
    private final AlertDispatcher dispatcher = new AlertDispatcher(
            KindRegistry.notifiers(List.<Notifier>of(notifier)), bus, clock, duration -> { }, 50);
    private final SchedulerService scheduler = new SchedulerService(
            KindRegistry.probers(List.<Prober>of(prober)),
            new ProbeContext(HttpClient.newHttpClient(), clock, blocking),
            tracker, dispatcher, bus, 4, 5);

    @AfterEach
    void tearDown() {
        scheduler.shutdown(Duration.ofMillis(200));
        dispatcher.shutdown(Duration.ofMillis(200));
        blocking.shutdownNow();
    }

    @Test
    void outageRaisesOneAlertPerNotifier() {
        prober.script("cache-a", HealthState.UP, null)
                .script("cache-a", HealthState.UP, null)
                .script("cache-a", HealthState.UP, null)
                .script("cache-a", HealthState.DOWN, "connection refused");
        Map<String, NotifierSpec> notifiers = new LinkedHashMap<>();
        notifiers.put("console", new NotifierSpec("console", "recording", Map.of(),
                "service_name={{service_name}} error_message={{error_message}}", RetryPolicy.DEFAULT));
        notifiers.put("ops-webhook", new NotifierSpec("ops-webhook", "recording", Map.of(),
                "{\"service_name\":\"{{service_name}}\",\"error_message\":\"{{error_message}}\"}", RetryPolicy.DEFAULT));
        dispatcher.applyNotifiers(notifiers);

        scheduler.schedule(new ServiceSpec("cache-a", ScriptedProber.KIND, Duration.ofMillis(20),
                Duration.ofSeconds(2), Map.of("command", "PING", "expect", "+PONG")));

        Await.until(() -> prober.calls("cache-a") >= 10, "ticks past the outage");
        Await.until(() -> dispatcher.recentDeliveries(10).size() == 2, "both deliveries recorded");

        List<StateTransition> transitions = events.byType(StateChanged.class).stream()
                .map(StateChanged::transition)
                .toList();
        assertEquals(1, transitions.size());
        assertEquals(HealthState.UP, transitions.get(0).oldState());
        assertEquals(HealthState.DOWN, transitions.get(0).newState());
        assertEquals("connection refused", transitions.get(0).error());

        assertEquals(1, notifier.callsFor("console").size());
        assertEquals(1, notifier.callsFor("ops-webhook").size());
        assertEquals("service_name=cache-a error_message=connection refused",
                notifier.callsFor("console").get(0).message().body());
        assertTrue(notifier.callsFor("ops-webhook").get(0).message().body()
                .contains("\"error_message\":\"connection refused\""));
        assertTrue(dispatcher.recentDeliveries(10).stream().allMatch(DeliveryRecord::success));
        assertEquals(HealthState.DOWN, tracker.currentState("cache-a").orElseThrow().state());
    }
}
