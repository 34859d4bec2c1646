package io.hypha.core.registry;

import io.hypha.core.CallerContext;
import io.hypha.core.HyphaException;
import io.hypha.core.InvalidIdentifierException;
import io.hypha.core.address.AddressNormalizer;
import io.hypha.core.address.RegistrationId;
import io.hypha.core.address.ServiceIdentifier;
import io.hypha.core.events.EventBus;
import io.hypha.core.events.Events;
import io.hypha.core.security.AccessGuard;
import io.hypha.core.service.ClientInfo;
import io.hypha.core.service.ServiceConfig;
import io.hypha.core.service.ServiceRecord;
import io.hypha.core.spi.PatternStore;
import io.hypha.core.store.GlobPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Writes service records to the pattern store and announces every change on the event bus.
 *
 * <p>
 * The store is the single source of truth for which services exist. The existence check and the
 * write in {@link #register(ServiceRecord, CallerContext)} are not atomic: two callers registering the
 * same key concurrently may both observe "added". Writes are last-write-wins per key.
 * </p>
 */
public final class ServiceRegistry {

    private static final Logger LOGGER = Logger.getLogger(ServiceRegistry.class.getName());

    private static final String BUILT_IN_SUFFIX = ":" + AddressNormalizer.BUILT_IN_SERVICE;

    private final PatternStore store;
    private final EventBus eventBus;
    private final AccessGuard guard;

    public ServiceRegistry(PatternStore store, EventBus eventBus, AccessGuard guard) {
        this.store = Objects.requireNonNull(store, "store");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    /**
     * Registers or overwrites a service.
     *
     * <p>
     * The id is canonicalized, security rules are applied, the record is written under
     * {@code services:<visibility>:<id>@<app_id>} and one of {@code service_added},
     * {@code service_updated}, {@code client_connected} or {@code client_updated} is emitted.
     * </p>
     *
     * @return the canonical record as stored.
     * @throws InvalidIdentifierException            for malformed ids, wildcard ids or an unknown visibility
     * @throws io.hypha.core.AccessDeniedException   when the caller may not register into the target workspace
     */
    public ServiceRecord register(ServiceRecord record, CallerContext context) throws HyphaException {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(context, "context");

        guard.checkRegistration(AddressNormalizer.registrationScope(record.id(), context.workspace()), context);
        RegistrationId id = AddressNormalizer.canonicalizeForRegistration(record.id(), context.workspace(), context.clientId());

        String appId = record.appId() == null || record.appId().isBlank() ? ServiceIdentifier.WILDCARD : record.appId();
        String visibility = record.config().visibility() == null ? AddressNormalizer.PROTECTED : record.config().visibility();
        if (!AddressNormalizer.PUBLIC.equals(visibility) && !AddressNormalizer.PROTECTED.equals(visibility)) {
            throw new InvalidIdentifierException("Unsupported visibility: " + visibility);
        }
        if (id.fullId().contains(ServiceIdentifier.WILDCARD)) {
            throw new InvalidIdentifierException("Service id must not contain '*': " + id.fullId());
        }

        ServiceConfig config = record.config().withVisibility(visibility).withWorkspace(id.workspace());
        ServiceRecord canonical = record.withId(id.fullId()).withAppId(appId).withConfig(config);
        ServiceIdentifier address = ServiceIdentifier.fromStorageKey(
            ServiceIdentifier.KEY_PREFIX + visibility + ":" + id.fullId() + "@" + appId);
        AddressNormalizer.validateIdentifier(address);

        String key = address.storageKey();
        String anyVisibility = ServiceIdentifier.KEY_PREFIX + ServiceIdentifier.WILDCARD + ":"
            + GlobPattern.literal(id.fullId() + "@" + appId);
        List<String> previous = store.keys(anyVisibility);
        boolean existed = !previous.isEmpty();
        for (String stale : previous) {
            if (!stale.equals(key)) {
                store.delete(GlobPattern.literal(stale));
            }
        }
        for (Map.Entry<String, String> field : ServiceRecordCodec.encode(canonical).entrySet()) {
            store.hset(key, field.getKey(), field.getValue());
        }

        boolean builtIn = id.fullId().endsWith(BUILT_IN_SUFFIX);
        if (existed) {
            if (builtIn) {
                LOGGER.info(() -> "[hypha-core] updating built-in service: " + canonical.id());
                eventBus.emit(Events.CLIENT_UPDATED, new ClientInfo(context.from(), id.workspace()));
            } else {
                LOGGER.info(() -> "[hypha-core] updating service: " + canonical.id());
                eventBus.emit(Events.SERVICE_UPDATED, canonical);
            }
        } else {
            if (builtIn) {
                LOGGER.info(() -> String.format(Locale.ROOT,
                    "[hypha-core] adding built-in service: %s, key: %s", canonical.id(), key));
                eventBus.emit(Events.CLIENT_CONNECTED, new ClientInfo(context.from(), id.workspace()));
            } else {
                LOGGER.info(() -> String.format(Locale.ROOT,
                    "[hypha-core] adding service %s, key: %s", canonical.id(), key));
                eventBus.emit(Events.SERVICE_ADDED, canonical);
            }
        }
        return canonical;
    }

    /**
     * Removes a service. Ids without {@code /} are taken relative to the caller's workspace; ids
     * without {@code @} remove every app instance.
     *
     * @return false when nothing matched; a warning is logged and nothing is emitted.
     */
    public boolean unregister(String serviceId, CallerContext context) throws HyphaException {
        Objects.requireNonNull(context, "context");
        String pattern = AddressNormalizer.unregisterPattern(serviceId, context.workspace());
        ServiceIdentifier target = ServiceIdentifier.fromStorageKey(pattern);
        if (target.fullId().contains(ServiceIdentifier.WILDCARD)) {
            throw new InvalidIdentifierException("Service id must not contain '*': " + serviceId);
        }

        List<String> keys = store.keys(pattern);
        if (keys.isEmpty()) {
            LOGGER.warning(() -> "[hypha-core] service " + pattern + " does not exist and cannot be removed.");
            return false;
        }

        List<ServiceRecord> removed = new ArrayList<>(keys.size());
        for (String key : keys) {
            removed.add(ServiceRecordCodec.decode(key, store.hgetall(key)));
        }
        store.delete(pattern);
        LOGGER.info(() -> String.format(Locale.ROOT, "[hypha-core] removed %d key(s) for %s", keys.size(), pattern));

        for (ServiceRecord record : removed) {
            if (record.id().endsWith(BUILT_IN_SUFFIX)) {
                eventBus.emit(Events.CLIENT_DISCONNECTED, new ClientInfo(context.from(), target.workspace()));
            } else {
                eventBus.emit(Events.SERVICE_REMOVED, record);
            }
        }
        return true;
    }
}
