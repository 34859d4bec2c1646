package io.hypha.core.readiness;

import io.hypha.core.HyphaException;
import io.hypha.core.ServiceTimeoutException;
import io.hypha.core.address.AddressNormalizer;
import io.hypha.core.events.EventBus;
import io.hypha.core.events.EventHandler;
import io.hypha.core.events.Events;
import io.hypha.core.service.ServiceHandle;
import io.hypha.core.service.ServiceRecord;
import io.hypha.core.spi.RemoteTransport;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Event-driven readiness waits.
 *
 * <p>
 * Every wait subscribes one listener and arms one timer; both are released as soon as the wait
 * settles, whichever of matching event, timer or {@link #cancel(String)} comes first. A matching
 * event disarms the timer, after which the default-service fetch is bounded by the fetch timeout
 * alone. Concurrent waits on the same target are independent of each other.
 * </p>
 *
 * <p>
 * The scheduler only fires timers. Fetches run on the {@code workers} executor so a slow client
 * never delays another wait's timeout.
 * </p>
 */
public final class ReadinessCoordinator implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ReadinessCoordinator.class.getName());

    static final String LEGACY_TYPE = "imjoy";
    private static final String DEFAULT_SUFFIX = ":" + AddressNormalizer.DEFAULT_SERVICE;

    private final EventBus eventBus;
    private final RemoteTransport transport;
    private final ScheduledExecutorService scheduler;
    private final Executor workers;
    private final Duration fetchTimeout;
    private final Clock clock;
    private final Map<String, PendingWait<?>> waits = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public ReadinessCoordinator(
        EventBus eventBus,
        RemoteTransport transport,
        ScheduledExecutorService scheduler,
        Executor workers,
        Duration fetchTimeout,
        Clock clock
    ) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Waits until the client {@code clientIdPrefix} ({@code workspace/client}) registers its default
     * service, fetches that service and emits {@code client_ready}.
     */
    public PendingWait<ServiceHandle> waitForClient(String clientIdPrefix, Duration timeout) {
        Objects.requireNonNull(clientIdPrefix, "clientIdPrefix");
        return arm(Events.SERVICE_ADDED, clientIdPrefix, timeout, (wait, payload) -> onServiceAdded(wait, clientIdPrefix, payload));
    }

    /**
     * Waits for a {@code connection_ready} event carrying the given connection id.
     */
    public PendingWait<ConnectionRecord> waitForConnection(String connectionId, Duration timeout) {
        Objects.requireNonNull(connectionId, "connectionId");
        return arm(Events.CONNECTION_READY, connectionId, timeout, (wait, payload) -> {
            if (payload instanceof ConnectionRecord && connectionId.equals(((ConnectionRecord) payload).id()) && wait.claim()) {
                wait.future().complete((ConnectionRecord) payload);
            }
        });
    }

    /**
     * Launch sequencing: waits for the connection, runs {@code onConnected}, then waits for the client's
     * default service. The client wait is armed up front so a registration racing {@code onConnected}
     * is not missed.
     */
    public CompletableFuture<ServiceHandle> awaitLaunch(
        String connectionId,
        Consumer<ConnectionRecord> onConnected,
        String clientIdPrefix,
        Duration connectionTimeout,
        Duration clientTimeout
    ) {
        PendingWait<ServiceHandle> client = waitForClient(clientIdPrefix, clientTimeout);
        PendingWait<ConnectionRecord> connection = waitForConnection(connectionId, connectionTimeout);
        connection.future().whenComplete((record, error) -> {
            if (error != null) {
                client.future().completeExceptionally(error);
            }
        });
        return connection.future().thenCompose(record -> {
            if (onConnected != null) {
                onConnected.accept(record);
            }
            return client.future();
        });
    }

    /**
     * @return true when a pending wait with this id was cancelled.
     */
    public boolean cancel(String waitId) {
        PendingWait<?> wait = waits.get(waitId);
        return wait != null && wait.cancel();
    }

    public int pendingCount() {
        return waits.size();
    }

    @Override
    public void close() {
        for (PendingWait<?> wait : new ArrayList<>(waits.values())) {
            wait.cancel();
        }
    }

    private <T> PendingWait<T> arm(String event, String target, Duration timeout, BiConsumer<PendingWait<T>, Object> onEvent) {
        Objects.requireNonNull(timeout, "timeout");
        String waitId = event + "-" + sequence.incrementAndGet();
        PendingWait<T> wait = new PendingWait<>(waitId, target, clock.instant().plus(timeout));
        EventHandler listener = payload -> {
            if (!wait.isDone()) {
                onEvent.accept(wait, payload);
            }
        };
        waits.put(waitId, wait);
        eventBus.on(event, listener);
        ScheduledFuture<?> timer = scheduler.schedule(
            () -> {
                if (wait.claim() && wait.future().completeExceptionally(new ServiceTimeoutException(target, timeout))) {
                    LOGGER.fine(() -> String.format(Locale.ROOT, "[hypha-core] %s timed out after %d ms", waitId, timeout.toMillis()));
                }
            },
            timeout.toMillis(),
            TimeUnit.MILLISECONDS);
        wait.arm(timer);
        wait.future().whenComplete((value, error) -> {
            eventBus.off(event, listener);
            wait.disarm();
            waits.remove(waitId);
        });
        return wait;
    }

    private void onServiceAdded(PendingWait<ServiceHandle> wait, String clientIdPrefix, Object payload) {
        if (!(payload instanceof ServiceRecord)) {
            return;
        }
        ServiceRecord record = (ServiceRecord) payload;
        int colon = record.id().indexOf(':');
        String prefix = colon < 0 ? record.id() : record.id().substring(0, colon);
        if (!clientIdPrefix.equals(prefix)) {
            return;
        }
        if (LEGACY_TYPE.equals(record.type())) {
            if (wait.claim()) {
                wait.future().complete(ServiceHandle.fromRecord(record));
            }
            return;
        }
        if (!record.id().endsWith(DEFAULT_SUFFIX)) {
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[hypha-core] ignoring service %s while waiting for the default service of %s", record.id(), clientIdPrefix));
            return;
        }
        if (!wait.claim()) {
            return;
        }
        try {
            workers.execute(() -> fetchDefault(wait, record.id()));
        } catch (RejectedExecutionException ex) {
            wait.future().completeExceptionally(new HyphaException("readiness fetch rejected for " + record.id(), ex));
        }
    }

    private void fetchDefault(PendingWait<ServiceHandle> wait, String serviceId) {
        try {
            ServiceHandle handle = transport.getRemoteService(serviceId, fetchTimeout);
            if (handle == null) {
                wait.future().completeExceptionally(new HyphaException("default service " + serviceId + " not found"));
                return;
            }
            // claimed, so only a cancellation can have settled the wait in the meantime
            if (!wait.isDone()) {
                eventBus.emit(Events.CLIENT_READY, handle);
                wait.future().complete(handle);
            }
        } catch (HyphaException | RuntimeException ex) {
            wait.future().completeExceptionally(ex);
        }
    }
}
