package com.healthsentinel.probes.log;

import com.healthsentinel.core.model.CheckOutcome;
import com.healthsentinel.core.model.HealthState;
import com.healthsentinel.core.model.NotifierSpec;
import com.healthsentinel.core.model.RetryPolicy;
import com.healthsentinel.core.model.StateTransition;
import com.healthsentinel.probes.api.DeliveryResult;
import com.healthsentinel.probes.api.RenderedMessage;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogNotifierTest {
    @Test
    void logsDownAsWarningAndRecoveryAsInfo() throws Exception {
        Logger logger = Logger.getLogger("test.alerts." + System.nanoTime());
        logger.setUseParentHandlers(false);
        List<LogRecord> records = new ArrayList<>();
        logger.addHandler(new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        });
        LogNotifier notifier = new LogNotifier(logger);
        NotifierSpec spec = new NotifierSpec("console", LogNotifier.KIND, Map.of(), "{{service_name}}", RetryPolicy.DEFAULT);
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        StateTransition down = StateTransition.from(HealthState.UP,
                CheckOutcome.down("cache-a", "tcp", 3, "connection refused", now));
        StateTransition up = StateTransition.from(HealthState.DOWN,
                CheckOutcome.up("cache-a", "tcp", 3, Map.of(), now));

        DeliveryResult first = notifier.deliver(new RenderedMessage("alert", "cache-a down", down), spec, Duration.ofSeconds(1)).get();
        notifier.deliver(new RenderedMessage("", "cache-a up", up), spec, Duration.ofSeconds(1)).get();

        assertTrue(first.success());
        assertEquals(2, records.size());
        assertEquals(Level.WARNING, records.get(0).getLevel());
        assertEquals("[console] alert | cache-a down", records.get(0).getMessage());
        assertEquals(Level.INFO, records.get(1).getLevel());
        assertEquals("[console] cache-a up", records.get(1).getMessage());
    }
}
