package io.hypha.core.events;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusTest {

    @Test
    void handlersRunInRegistrationOrder() {
        EventBus bus = new EventBus();
        List<String> seen = new ArrayList<>();
        bus.on("e", payload -> seen.add("first:" + payload));
        bus.on("e", payload -> seen.add("second:" + payload));

        bus.emit("e", "x");

        assertEquals(List.of("first:x", "second:x"), seen);
    }

    @Test
    void failingHandlerDoesNotStopOthers() {
        EventBus bus = new EventBus();
        List<Object> seen = new ArrayList<>();
        bus.on("e", payload -> {
            throw new IllegalStateException("boom");
        });
        bus.on("e", seen::add);

        bus.emit("e", 1);

        assertEquals(List.of(1), seen);
    }

    @Test
    void onceHandlerRunsASingleTime() {
        EventBus bus = new EventBus();
        List<Object> seen = new ArrayList<>();
        bus.once("e", seen::add);

        bus.emit("e", 1);
        bus.emit("e", 2);

        assertEquals(List.of(1), seen);
        assertEquals(0, bus.listenerCount("e"));
    }

    @Test
    void offRemovesOnlyTheGivenHandler() {
        EventBus bus = new EventBus();
        List<Object> seen = new ArrayList<>();
        EventHandler removed = payload -> seen.add("removed");
        bus.on("e", removed);
        bus.on("e", payload -> seen.add("kept"));

        assertTrue(bus.off("e", removed));
        assertFalse(bus.off("e", removed));
        bus.emit("e", null);

        assertEquals(List.of("kept"), seen);
    }

    @Test
    void emitWithoutHandlersIsANoOp() {
        new EventBus().emit("nobody-listens", "payload");
    }
}
