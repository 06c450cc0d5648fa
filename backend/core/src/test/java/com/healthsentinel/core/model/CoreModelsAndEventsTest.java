package com.healthsentinel.core.model;

import com.healthsentinel.core.events.AlertDelivered;
import com.healthsentinel.core.events.AlertRaised;
import com.healthsentinel.core.events.ConfigRejected;
import com.healthsentinel.core.events.ConfigReloaded;
import com.healthsentinel.core.events.DeliveryAttempted;
import com.healthsentinel.core.events.StateChanged;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreModelsAndEventsTest {
    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");

    @Test
    void serviceStatsAccumulateChecksLatencyAndChanges() {
        ServiceStats stats = ServiceStats.empty("user-api")
                .record(CheckOutcome.up("user-api", "http", 10, Map.of(), NOW), false)
                .record(CheckOutcome.up("user-api", "http", 30, Map.of(), NOW), false)
                .record(CheckOutcome.down("user-api", "http", 20, "HTTP status 503", NOW), true);

        assertEquals(3, stats.totalChecks());
        assertEquals(2, stats.healthyChecks());
        assertEquals(1, stats.unhealthyChecks());
        assertEquals(2.0 / 3, stats.healthRate(), 1e-9);
        assertEquals(20.0, stats.averageLatencyMillis(), 1e-9);
        assertEquals(1, stats.stateChanges());
        assertEquals(0.0, ServiceStats.empty("idle").healthRate());
    }

    @Test
    void transitionCopiesOutcomeFields() {
        CheckOutcome outcome = CheckOutcome.down("cache-a", "tcp", 12, "connection refused", NOW);

        StateTransition transition = StateTransition.from(HealthState.UP, outcome);

        assertEquals("cache-a", transition.serviceName());
        assertEquals("tcp", transition.serviceKind());
        assertEquals(HealthState.UP, transition.oldState());
        assertEquals(HealthState.DOWN, transition.newState());
        assertEquals(12, transition.latencyMillis());
        assertEquals("connection refused", transition.error());
        assertFalse(outcome.healthy());
    }

    @Test
    void retryPolicyDelaysGrowAndAreCapped() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), 3.0, Duration.ofMillis(500), Duration.ofSeconds(1));

        assertEquals(Duration.ofMillis(100), policy.delayAfterAttempt(1));
        assertEquals(Duration.ofMillis(300), policy.delayAfterAttempt(2));
        assertEquals(Duration.ofMillis(500), policy.delayAfterAttempt(3));
        assertEquals(Duration.ofMillis(500), policy.delayAfterAttempt(4));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ZERO, 2.0, Duration.ZERO, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(1, Duration.ZERO, 0.5, Duration.ZERO, Duration.ofSeconds(1)));
    }

    @Test
    void serviceSpecSeparatesCadenceFromProbeTarget() {
        ServiceSpec spec = new ServiceSpec("cache-a", "tcp", Duration.ofSeconds(10), Duration.ofSeconds(2),
                Map.of("host", "localhost", "port", 6379));

        assertTrue(spec.sameProbeTarget(spec.withInterval(Duration.ofSeconds(60))));
        assertFalse(spec.sameProbeTarget(new ServiceSpec("cache-a", "tcp", Duration.ofSeconds(10),
                Duration.ofSeconds(2), Map.of("host", "localhost", "port", 6380))));
        assertEquals(1, spec.failureThreshold());
        assertThrows(IllegalArgumentException.class, () -> new ServiceSpec("x", "tcp", Duration.ofSeconds(1),
                Duration.ofSeconds(1), Map.of(), 0));
    }

    @Test
    void notifierSpecDefaultsToAllStatesAndDefaultBody() {
        NotifierSpec all = new NotifierSpec("ops", "log", Map.of(), null, RetryPolicy.DEFAULT);
        NotifierSpec downOnly = new NotifierSpec("pager", "webhook", Map.of(), null, "{{service_name}}",
                RetryPolicy.DEFAULT, 2, Set.of(HealthState.DOWN));

        assertEquals(NotifierSpec.DEFAULT_BODY, all.bodyTemplate());
        assertTrue(all.triggersOn(HealthState.UP));
        assertTrue(downOnly.triggersOn(HealthState.DOWN));
        assertFalse(downOnly.triggersOn(HealthState.UP));
        assertNull(all.subjectTemplate());
    }

    @Test
    void eventsExposeTypeAndPayload() {
        StateTransition transition = StateTransition.from(null, CheckOutcome.down("db", "http", 1, "timeout", NOW));
        DeliveryRecord record = new DeliveryRecord("ops", "db", HealthState.DOWN, true, 2, null, NOW);

        assertEquals("StateChanged", new StateChanged(NOW, transition).type());
        assertEquals("DeliveryAttempted", new DeliveryAttempted(NOW, "ops", "db", 1, false, "timeout").type());
        assertEquals("AlertDelivered", new AlertDelivered(NOW, record).type());
        assertEquals("AlertRaised", new AlertRaised(NOW, "probe", "boom", Map.of()).type());
        assertEquals("ConfigReloaded", new ConfigReloaded(NOW, List.of("a"), List.of(), List.of(), List.of()).type());
        assertEquals("ConfigRejected", new ConfigRejected(NOW, "monitor.yaml", List.of("bad")).type());
        assertEquals(2, record.attempts());
    }
}
