package io.hypha.core.readiness;

import io.hypha.core.HyphaException;
import io.hypha.core.events.EventBus;
import io.hypha.core.events.Events;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionRegistryTest {

    private final EventBus bus = new EventBus();
    private final ConnectionRegistry registry = new ConnectionRegistry(bus);

    @Test
    void openRejectsDuplicateIds() throws Exception {
        registry.open("c1", "ws", "socket", message -> { });

        assertThrows(HyphaException.class, () -> registry.open("c1", "ws", "socket", message -> { }));
    }

    @Test
    void sendGoesThroughTheSink() throws Exception {
        List<Map<String, Object>> sent = new ArrayList<>();
        registry.open("c1", "ws", "socket", sent::add);

        registry.send("c1", Map.of("type", "initialize"));

        assertEquals(List.of(Map.of("type", "initialize")), sent);
    }

    @Test
    void markReadyEmitsTheRecord() throws Exception {
        List<Object> ready = new ArrayList<>();
        bus.on(Events.CONNECTION_READY, ready::add);
        ConnectionRecord record = registry.open("c1", "ws", "socket", message -> { });

        registry.markReady("c1");

        assertEquals(1, ready.size());
        assertSame(record, ready.get(0));
    }

    @Test
    void closedConnectionsAreGone() throws Exception {
        registry.open("c2", "ws", null, message -> { });
        registry.open("c1", "ws", null, message -> { });
        assertEquals("c1", registry.list().get(0).id());

        assertTrue(registry.close("c1"));
        assertFalse(registry.close("c1"));
        assertNull(registry.get("c1"));
        assertThrows(HyphaException.class, () -> registry.markReady("c1"));
        assertThrows(HyphaException.class, () -> registry.send("c1", Map.of()));
    }
}
