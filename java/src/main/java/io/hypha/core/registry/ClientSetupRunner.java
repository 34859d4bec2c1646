package io.hypha.core.registry;

import io.hypha.core.HyphaException;
import io.hypha.core.address.AddressNormalizer;
import io.hypha.core.events.EventBus;
import io.hypha.core.events.EventHandler;
import io.hypha.core.events.Events;
import io.hypha.core.service.ServiceHandle;
import io.hypha.core.service.ServiceRecord;
import io.hypha.core.spi.RemoteTransport;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Calls {@code setup()} on a client's default service the first time it is registered.
 *
 * <p>
 * Best effort: attempts are scheduled after each configured delay (100 ms, 400 ms and 1600 ms by
 * default). Failures are logged and never reach the registrant. The scheduler only times the
 * attempts; the blocking fetch and {@code setup()} call run on {@code workers}.
 * </p>
 */
public final class ClientSetupRunner implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ClientSetupRunner.class.getName());
    private static final String DEFAULT_SUFFIX = ":" + AddressNormalizer.DEFAULT_SERVICE;

    private final RemoteTransport transport;
    private final EventBus eventBus;
    private final ScheduledExecutorService scheduler;
    private final Executor workers;
    private final List<Duration> delays;
    private final Duration timeout;
    private final EventHandler listener = this::onServiceAdded;

    public ClientSetupRunner(
        RemoteTransport transport,
        EventBus eventBus,
        ScheduledExecutorService scheduler,
        Executor workers,
        List<Duration> delays,
        Duration timeout
    ) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.delays = List.copyOf(Objects.requireNonNull(delays, "delays"));
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public void start() {
        eventBus.on(Events.SERVICE_ADDED, listener);
    }

    @Override
    public void close() {
        eventBus.off(Events.SERVICE_ADDED, listener);
    }

    private void onServiceAdded(Object payload) {
        if (!(payload instanceof ServiceRecord)) {
            return;
        }
        ServiceRecord record = (ServiceRecord) payload;
        if (!record.id().endsWith(DEFAULT_SUFFIX) || delays.isEmpty()) {
            return;
        }
        schedule(record.id(), 0);
    }

    private void schedule(String serviceId, int attempt) {
        Duration delay = delays.get(attempt);
        scheduler.schedule(() -> dispatch(serviceId, attempt), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void dispatch(String serviceId, int attempt) {
        try {
            workers.execute(() -> runAttempt(serviceId, attempt));
        } catch (RejectedExecutionException ex) {
            LOGGER.fine(() -> "[hypha-core] dropped setup for " + serviceId + ", workers shut down");
        }
    }

    private void runAttempt(String serviceId, int attempt) {
        try {
            ServiceHandle handle = transport.getRemoteService(serviceId, timeout);
            if (handle == null) {
                throw new HyphaException("default service " + serviceId + " not reachable");
            }
            if (handle.has("setup")) {
                handle.call("setup");
                LOGGER.fine(() -> "[hypha-core] ran setup for default service " + serviceId);
            }
        } catch (HyphaException | RuntimeException ex) {
            int next = attempt + 1;
            if (next < delays.size()) {
                LOGGER.warning(() -> String.format(Locale.ROOT,
                    "[hypha-core] setup attempt %d for %s failed: %s", next, serviceId, ex.getMessage()));
                schedule(serviceId, next);
            } else {
                LOGGER.log(Level.SEVERE, ex, () -> String.format(Locale.ROOT,
                    "[hypha-core] failed to run setup for default service `%s` after %d attempts",
                    serviceId, delays.size()));
            }
        }
    }
}
