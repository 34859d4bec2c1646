package io.hypha.core.events;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide publish/subscribe bus.
 *
 * <p>
 * {@link #emit(String, Object)} runs every handler of the event on the calling thread, in the order
 * the handlers were added, and returns once all of them finished. A failing handler is logged and
 * does not prevent the remaining handlers from running.
 * </p>
 */
public final class EventBus {

    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<String, List<Subscription>> handlers = new ConcurrentHashMap<>();

    public void on(String event, EventHandler handler) {
        subscribe(event, handler, false);
    }

    /**
     * Registers a handler that is removed after its first invocation.
     */
    public void once(String event, EventHandler handler) {
        subscribe(event, handler, true);
    }

    /**
     * Removes the first registration of {@code handler} for {@code event}.
     *
     * @return true when a registration was removed.
     */
    public boolean off(String event, EventHandler handler) {
        List<Subscription> list = handlers.get(event);
        if (list == null) {
            return false;
        }
        for (Subscription subscription : list) {
            if (subscription.handler == handler) {
                return list.remove(subscription);
            }
        }
        return false;
    }

    /**
     * Removes every handler registered for {@code event}.
     */
    public void off(String event) {
        handlers.remove(event);
    }

    public int listenerCount(String event) {
        List<Subscription> list = handlers.get(event);
        return list == null ? 0 : list.size();
    }

    public void emit(String event, Object payload) {
        Objects.requireNonNull(event, "event");
        List<Subscription> list = handlers.get(event);
        if (list == null || list.isEmpty()) {
            LOGGER.finest(() -> "[hypha-core] unhandled event " + event);
            return;
        }
        for (Subscription subscription : list) {
            if (subscription.once && !list.remove(subscription)) {
                continue;
            }
            try {
                subscription.handler.onEvent(payload);
            } catch (Exception ex) {
                LOGGER.log(Level.SEVERE, ex, () -> String.format(Locale.ROOT,
                    "[hypha-core] handler for %s failed: %s", event, ex.getMessage()));
            }
        }
    }

    private void subscribe(String event, EventHandler handler, boolean once) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(handler, "handler");
        handlers.computeIfAbsent(event, k -> new CopyOnWriteArrayList<>()).add(new Subscription(handler, once));
    }

    private static final class Subscription {
        private final EventHandler handler;
        private final boolean once;

        private Subscription(EventHandler handler, boolean once) {
            this.handler = handler;
            this.once = once;
        }
    }
}
