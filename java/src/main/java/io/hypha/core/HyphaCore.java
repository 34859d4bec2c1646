package io.hypha.core;

import io.hypha.core.address.AddressNormalizer;
import io.hypha.core.address.RegistrationId;
import io.hypha.core.address.ServiceIdentifier;
import io.hypha.core.address.ServiceQuery;
import io.hypha.core.auth.ContextResolver;
import io.hypha.core.auth.TokenClaims;
import io.hypha.core.auth.TokenIssuer;
import io.hypha.core.auth.TokenRequest;
import io.hypha.core.events.EventBus;
import io.hypha.core.events.EventHandler;
import io.hypha.core.events.Events;
import io.hypha.core.readiness.ConnectionRecord;
import io.hypha.core.readiness.ConnectionRegistry;
import io.hypha.core.readiness.PendingWait;
import io.hypha.core.readiness.ReadinessCoordinator;
import io.hypha.core.registry.ClientSetupRunner;
import io.hypha.core.registry.ServiceRegistry;
import io.hypha.core.resolve.GetOptions;
import io.hypha.core.resolve.ServiceResolver;
import io.hypha.core.security.AccessGuard;
import io.hypha.core.service.ServiceConfig;
import io.hypha.core.service.ServiceHandle;
import io.hypha.core.service.ServiceImplementation;
import io.hypha.core.service.ServiceRecord;
import io.hypha.core.spi.AppLauncher;
import io.hypha.core.spi.PatternStore;
import io.hypha.core.spi.RemoteTransport;
import io.hypha.core.store.GlobPattern;
import io.hypha.core.store.InMemoryPatternStore;
import io.hypha.core.transport.InProcessTransport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Entry point wiring the registry, resolver, token issuer and readiness coordinator around one
 * pattern store, one event bus and one transport.
 *
 * <p>
 * Instances are independent of each other; nothing here is process-global. Call {@link #start()} once
 * before use and {@link #close()} when done.
 * </p>
 *
 * <p>
 * Timers run on the scheduler; blocking fetches and {@code setup()} calls run on a worker pool owned
 * by this instance.
 * </p>
 */
public final class HyphaCore implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(HyphaCore.class.getName());

    private final HyphaConfig config;
    private final PatternStore store;
    private final EventBus eventBus;
    private final InProcessTransport transport;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final ExecutorService workers;
    private final AccessGuard guard = new AccessGuard();
    private final ServiceRegistry registry;
    private final ServiceResolver resolver;
    private final TokenIssuer tokenIssuer;
    private final ContextResolver contextResolver;
    private final ReadinessCoordinator readiness;
    private final ConnectionRegistry connections;
    private final ClientSetupRunner setupRunner;
    private final Map<String, ServiceHandle> apps = new ConcurrentSkipListMap<>();
    private final EventHandler clientReadyListener = this::onClientReady;
    private final EventHandler serviceRemovedListener = this::onServiceRemoved;
    private final AtomicBoolean started = new AtomicBoolean();

    private HyphaCore(Builder builder) {
        this.config = (builder.config == null ? HyphaConfig.builder().build() : builder.config).withDefaults();
        this.store = builder.store == null ? new InMemoryPatternStore() : builder.store;
        this.eventBus = builder.eventBus == null ? new EventBus() : builder.eventBus;
        this.transport = new InProcessTransport(builder.transport);
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler
            ? Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "hypha-core-scheduler");
                thread.setDaemon(true);
                return thread;
            })
            : builder.scheduler;
        AtomicInteger workerCount = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "hypha-core-worker-" + workerCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        this.registry = new ServiceRegistry(store, eventBus, guard);
        this.resolver = new ServiceResolver(store, transport, builder.launcher, config.getServiceTimeout());
        this.tokenIssuer = new TokenIssuer(
            config.getJwtSecret(), config.getTokenTtl(), config.getIssuer(), config.getAudience(), config.getClock(), guard);
        this.contextResolver = new ContextResolver(tokenIssuer, config.getClock());
        this.readiness = new ReadinessCoordinator(eventBus, transport, scheduler, workers, config.getServiceTimeout(), config.getClock());
        this.connections = new ConnectionRegistry(eventBus);
        this.setupRunner = new ClientSetupRunner(
            transport, eventBus, scheduler, workers, config.getSetupRetryDelays(), config.getServiceTimeout());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Subscribes the internal listeners and registers the workspace-manager default service.
     *
     * @throws IllegalStateException when called twice
     */
    public void start() throws HyphaException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("HyphaCore already started");
        }
        setupRunner.start();
        eventBus.on(Events.CLIENT_READY, clientReadyListener);
        eventBus.on(Events.SERVICE_REMOVED, serviceRemovedListener);

        WorkspaceManagerService manager = new WorkspaceManagerService(this);
        ServiceRecord record = new ServiceRecord(
            AddressNormalizer.DEFAULT_SERVICE,
            "Workspace Manager",
            "Registers, looks up and lists services, and issues tokens",
            "workspace-manager",
            null,
            new ServiceConfig(AddressNormalizer.PUBLIC, null, true, Map.of()),
            ServiceImplementation.local(manager.functions()));
        ServiceRecord registered = registerService(record, managerContext());
        LOGGER.info(() -> "[hypha-core] started, manager service " + registered.id());
    }

    /**
     * Registers a service on behalf of {@code context}. Local implementations become reachable through
     * the in-process transport under the canonical id; any other implementation replaces a local
     * binding left by an earlier registration of the same id.
     */
    public ServiceRecord registerService(ServiceRecord record, CallerContext context) throws HyphaException {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(context, "context");
        if (!(record.implementation() instanceof ServiceImplementation.Local)) {
            ServiceRecord canonical = registry.register(record, context);
            if (transport.unbind(canonical.id())) {
                LOGGER.fine(() -> "[hypha-core] dropped local binding of " + canonical.id());
            }
            return canonical;
        }

        // nothing is bound for a caller the guard rejects
        guard.checkRegistration(AddressNormalizer.registrationScope(record.id(), context.workspace()), context);
        RegistrationId id = AddressNormalizer.canonicalizeForRegistration(record.id(), context.workspace(), context.clientId());
        // bind before the write so listeners reacting to service_added can already fetch the service
        boolean wasBound = transport.isBound(id.fullId());
        if (!wasBound) {
            transport.bind(record.withId(id.fullId()).withConfig(record.config().withWorkspace(id.workspace())));
        }
        ServiceRecord canonical;
        try {
            canonical = registry.register(record, context);
        } catch (HyphaException | RuntimeException ex) {
            if (!wasBound) {
                transport.unbind(id.fullId());
            }
            throw ex;
        }
        transport.bind(canonical);
        return canonical;
    }

    /**
     * Registers a service exported by a client. Bare names are qualified with the caller's workspace
     * and client id ({@code calc} becomes {@code ws/client:calc}), {@code client:name} with the
     * caller's workspace.
     */
    public ServiceRecord exportService(ServiceRecord record, CallerContext context) throws HyphaException {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(context, "context");
        return registerService(record.withId(qualify(record.id(), context)), context);
    }

    public boolean unregisterService(String serviceId, CallerContext context) throws HyphaException {
        boolean removed = registry.unregister(serviceId, context);
        if (removed) {
            String id = serviceId.indexOf('/') >= 0 ? serviceId : context.workspace() + "/" + serviceId;
            String fullId = id.indexOf('@') >= 0 ? id.substring(0, id.indexOf('@')) : id;
            String remaining = ServiceIdentifier.KEY_PREFIX + ServiceIdentifier.WILDCARD + ":" + GlobPattern.literal(fullId) + "@*";
            if (store.keys(remaining).isEmpty()) {
                transport.unbind(fullId);
            }
        }
        return removed;
    }

    public ServiceHandle getService(String id, CallerContext context) throws HyphaException {
        return resolver.get(id, context);
    }

    public ServiceHandle getService(ServiceQuery query, GetOptions options, CallerContext context) throws HyphaException {
        return resolver.get(query, options, context);
    }

    public List<ServiceRecord> listServices(ServiceQuery query, CallerContext context) throws HyphaException {
        return resolver.list(query, context);
    }

    public List<ServiceRecord> listServices(String shorthand, CallerContext context) throws HyphaException {
        return resolver.list(shorthand, context);
    }

    public List<ServiceRecord> listServices(Map<String, ?> query, CallerContext context) throws HyphaException {
        return resolver.list(query, context);
    }

    public String generateToken(TokenRequest request, CallerContext context) throws HyphaException {
        return tokenIssuer.issue(request, context);
    }

    public TokenClaims verifyToken(String token) throws HyphaException {
        return tokenIssuer.verify(token);
    }

    public CallerContext contextFromToken(String token) {
        return contextResolver.fromToken(token);
    }

    public CallerContext contextFromToken(String token, String workspaceOverride, String clientOverride) {
        return contextResolver.fromToken(token, workspaceOverride, clientOverride);
    }

    /**
     * @param timeout {@code null} uses the configured client-ready timeout
     */
    public PendingWait<ServiceHandle> waitForClient(String clientIdPrefix, Duration timeout) {
        return readiness.waitForClient(clientIdPrefix, timeout == null ? config.getClientReadyTimeout() : timeout);
    }

    /**
     * @param timeout {@code null} uses the configured connection-ready timeout
     */
    public PendingWait<ConnectionRecord> waitForConnection(String connectionId, Duration timeout) {
        return readiness.waitForConnection(connectionId, timeout == null ? config.getConnectionReadyTimeout() : timeout);
    }

    public CompletableFuture<ServiceHandle> awaitLaunch(
        String connectionId,
        Consumer<ConnectionRecord> onConnected,
        String clientIdPrefix
    ) {
        return readiness.awaitLaunch(
            connectionId, onConnected, clientIdPrefix, config.getConnectionReadyTimeout(), config.getClientReadyTimeout());
    }

    public boolean cancelWait(String waitId) {
        return readiness.cancel(waitId);
    }

    public ConnectionRegistry connections() {
        return connections;
    }

    /**
     * @return default services of clients that completed the readiness handshake, sorted by id.
     */
    public List<ServiceHandle> apps() {
        return new ArrayList<>(apps.values());
    }

    public ServiceHandle app(String id) {
        return apps.get(id);
    }

    public EventBus events() {
        return eventBus;
    }

    public HyphaConfig config() {
        return config;
    }

    /**
     * @return the context the workspace manager acts under: its own client in {@code default}.
     */
    public CallerContext managerContext() {
        UserInfo manager = new UserInfo(config.getManagerClientId(), "", List.of("admin"), List.of(), false);
        return CallerContext.of(AccessGuard.DEFAULT_WORKSPACE, config.getManagerClientId(), manager);
    }

    @Override
    public void close() {
        readiness.close();
        setupRunner.close();
        eventBus.off(Events.CLIENT_READY, clientReadyListener);
        eventBus.off(Events.SERVICE_REMOVED, serviceRemovedListener);
        workers.shutdownNow();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        LOGGER.fine("[hypha-core] closed");
    }

    static String qualify(String id, CallerContext context) {
        if (id == null || id.indexOf('/') >= 0) {
            return id;
        }
        if (id.indexOf(':') >= 0) {
            return context.workspace() + "/" + id;
        }
        return context.workspace() + "/" + context.clientId() + ":" + id;
    }

    private void onClientReady(Object payload) {
        if (payload instanceof ServiceHandle) {
            ServiceHandle handle = (ServiceHandle) payload;
            apps.put(handle.getId(), handle);
            LOGGER.info(() -> String.format(Locale.ROOT, "[hypha-core] client ready: %s", handle.getId()));
        }
    }

    private void onServiceRemoved(Object payload) {
        if (payload instanceof ServiceRecord) {
            apps.remove(((ServiceRecord) payload).id());
        }
    }

    public static final class Builder {
        private HyphaConfig config;
        private PatternStore store;
        private EventBus eventBus;
        private RemoteTransport transport;
        private AppLauncher launcher;
        private ScheduledExecutorService scheduler;

        private Builder() {
        }

        public Builder config(HyphaConfig config) {
            this.config = config;
            return this;
        }

        public Builder store(PatternStore store) {
            this.store = store;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        /**
         * Transport for services not hosted in this process.
         */
        public Builder transport(RemoteTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder launcher(AppLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public HyphaCore build() {
            return new HyphaCore(this);
        }
    }
}
