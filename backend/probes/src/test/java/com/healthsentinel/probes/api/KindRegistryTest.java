package com.healthsentinel.probes.api;

import com.healthsentinel.probes.http.HttpProber;
import com.healthsentinel.probes.tcp.TcpProber;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KindRegistryTest {
    @Test
    void lookupIsCaseInsensitive() {
        KindRegistry<Prober> registry = KindRegistry.probers(List.of(new HttpProber(), new TcpProber()));

        assertInstanceOf(HttpProber.class, registry.require("HTTP"));
        assertInstanceOf(TcpProber.class, registry.require(" tcp "));
        assertEquals(Set.of("http", "tcp"), registry.kinds());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void unknownKindListsSupportedKinds() {
        KindRegistry<Prober> registry = KindRegistry.probers(List.of(new HttpProber()));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> registry.require("smtp"));
        assertTrue(error.getMessage().contains("smtp"));
        assertTrue(error.getMessage().contains("[http]"));
    }

    @Test
    void duplicateKindsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> KindRegistry.probers(List.of(new HttpProber(), new HttpProber())));
    }
}
