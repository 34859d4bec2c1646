package io.hypha.core.resolve;

import io.hypha.core.CallerContext;
import io.hypha.core.HyphaException;
import io.hypha.core.InvalidIdentifierException;
import io.hypha.core.ServiceTimeoutException;
import io.hypha.core.address.AddressNormalizer;
import io.hypha.core.address.ListPlan;
import io.hypha.core.address.NormalizedQuery;
import io.hypha.core.address.ServiceIdentifier;
import io.hypha.core.address.ServiceQuery;
import io.hypha.core.registry.ServiceRecordCodec;
import io.hypha.core.service.ServiceHandle;
import io.hypha.core.service.ServiceRecord;
import io.hypha.core.spi.AppLauncher;
import io.hypha.core.spi.PatternStore;
import io.hypha.core.spi.RemoteTransport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Finds services in the pattern store and turns them into callable handles.
 *
 * <p>
 * Candidates in the caller's own workspace are always tried before candidates elsewhere. Misses are
 * reported as {@code null} (for {@link #get}) or an empty list (for {@link #list}).
 * </p>
 */
public final class ServiceResolver {

    private static final Logger LOGGER = Logger.getLogger(ServiceResolver.class.getName());

    private final PatternStore store;
    private final RemoteTransport transport;
    private final AppLauncher launcher;
    private final Duration defaultTimeout;
    private final Random random;

    public ServiceResolver(PatternStore store, RemoteTransport transport, AppLauncher launcher, Duration defaultTimeout) {
        this(store, transport, launcher, defaultTimeout, new Random());
    }

    public ServiceResolver(
        PatternStore store,
        RemoteTransport transport,
        AppLauncher launcher,
        Duration defaultTimeout,
        Random random
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.launcher = launcher == null ? AppLauncher.NONE : launcher;
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        this.random = Objects.requireNonNull(random, "random");
    }

    public ServiceHandle get(String id, CallerContext context) throws HyphaException {
        return get(ServiceQuery.ofId(id), GetOptions.defaults(), context);
    }

    public ServiceHandle get(Map<String, ?> query, GetOptions options, CallerContext context) throws HyphaException {
        return get(ServiceQuery.fromMap(query), options, context);
    }

    /**
     * Resolves a single service.
     *
     * @return the first reachable candidate with {@code config.workspace} set to the workspace it was
     *     found in, or {@code null} when nothing matched
     * @throws ServiceTimeoutException when a candidate times out and {@code skipTimeout} is off
     */
    public ServiceHandle get(ServiceQuery query, GetOptions options, CallerContext context) throws HyphaException {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(context, "context");
        GetOptions effective = options == null ? GetOptions.defaults() : options;
        Duration timeout = effective.getTimeout() == null ? defaultTimeout : effective.getTimeout();

        NormalizedQuery normalized = AddressNormalizer.normalize(query, context.workspace());
        ServiceIdentifier address = normalized.address();
        if (normalized.direct()) {
            ServiceHandle handle = transport.getRemoteService(address.fullId(), timeout);
            return handle == null ? null : handle.withWorkspace(address.workspace());
        }

        // TODO: check read permission on workspaces other than the caller's before returning protected services
        ServiceHandle found = search(normalized, effective, timeout, context);
        if (found != null || !normalized.launchable()) {
            return found;
        }
        LOGGER.info(() -> String.format(Locale.ROOT, "[hypha-core] launching app %s for %s", address.appId(), address));
        launcher.launch(address, context);
        return search(normalized, effective, timeout, context);
    }

    public List<ServiceRecord> list(String shorthand, CallerContext context) throws HyphaException {
        return list(shorthand == null ? null : AddressNormalizer.parseListShorthand(shorthand), context);
    }

    public List<ServiceRecord> list(Map<String, ?> query, CallerContext context) throws HyphaException {
        return list(query == null ? null : ServiceQuery.fromMap(query), context);
    }

    /**
     * Lists service metadata matching the query, deduplicated and sorted by storage key.
     * A {@code null} query lists the caller's workspace.
     */
    public List<ServiceRecord> list(ServiceQuery query, CallerContext context) throws HyphaException {
        Objects.requireNonNull(context, "context");
        ListPlan plan = AddressNormalizer.planListing(query, context.workspace());
        Set<String> keys = new TreeSet<>(store.keys(plan.pattern().storageKey()));
        if (plan.callerScoped() != null) {
            keys.addAll(store.keys(plan.callerScoped().storageKey()));
        }
        List<ServiceRecord> records = new ArrayList<>(keys.size());
        for (String key : keys) {
            ServiceRecord record = ServiceRecordCodec.decode(key, store.hgetall(key));
            if (plan.typeFilter() == null || plan.typeFilter().equals(record.type())) {
                records.add(record);
            }
        }
        return records;
    }

    private ServiceHandle search(NormalizedQuery normalized, GetOptions options, Duration timeout, CallerContext context)
        throws HyphaException {
        Set<String> keys = new LinkedHashSet<>(store.keys(normalized.address().storageKey()));
        if (normalized.callerScoped() != null) {
            keys.addAll(store.keys(normalized.callerScoped().storageKey()));
        }
        LOGGER.fine(() -> String.format(Locale.ROOT, "[hypha-core] %d candidate(s) for %s", keys.size(), normalized.address()));

        for (ServiceIdentifier candidate : rank(keys, context.workspace(), options.isRandom())) {
            ServiceHandle handle;
            try {
                handle = transport.getRemoteService(candidate.fullId(), timeout);
            } catch (ServiceTimeoutException ex) {
                if (!options.isSkipTimeout()) {
                    throw ex;
                }
                LOGGER.warning(() -> "[hypha-core] skipping " + candidate.fullId() + ": " + ex.getMessage());
                continue;
            }
            if (handle != null) {
                return handle.withWorkspace(candidate.workspace());
            }
        }
        return null;
    }

    /**
     * Orders candidate keys: caller's workspace first, then everything else. Each bucket is sorted, or
     * shuffled independently in random mode.
     */
    List<ServiceIdentifier> rank(Collection<String> keys, String callerWorkspace, boolean shuffle) {
        List<ServiceIdentifier> within = new ArrayList<>();
        List<ServiceIdentifier> outside = new ArrayList<>();
        for (String key : keys) {
            ServiceIdentifier parsed;
            try {
                parsed = ServiceIdentifier.fromStorageKey(key);
            } catch (InvalidIdentifierException ex) {
                LOGGER.warning(() -> "[hypha-core] ignoring malformed key " + key + ": " + ex.getMessage());
                continue;
            }
            if (parsed.workspace().equals(callerWorkspace)) {
                within.add(parsed);
            } else {
                outside.add(parsed);
            }
        }
        order(within, shuffle);
        order(outside, shuffle);
        List<ServiceIdentifier> ranked = new ArrayList<>(within.size() + outside.size());
        ranked.addAll(within);
        ranked.addAll(outside);
        return ranked;
    }

    private void order(List<ServiceIdentifier> bucket, boolean shuffle) {
        if (shuffle) {
            Collections.shuffle(bucket, random);
        } else {
            bucket.sort((a, b) -> a.storageKey().compareTo(b.storageKey()));
        }
    }
}
