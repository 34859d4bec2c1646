package io.hypha.core.address;

import io.hypha.core.InvalidIdentifierException;
import io.hypha.core.InvalidQueryException;

import java.util.regex.Pattern;

/**
 * Parses, validates and canonicalizes service ids and queries.
 *
 * <p>
 * Lookups accept four shorthand forms, optionally followed by {@code @<app_id>}:
 * </p>
 * <table>
 *   <caption>Shorthand resolution</caption>
 *   <tr><th>Form</th><th>Workspace</th><th>Client</th><th>Service</th></tr>
 *   <tr><td>{@code ws/client}</td><td>{@code ws}</td><td>{@code client}</td><td>{@code default}</td></tr>
 *   <tr><td>{@code name}</td><td>query or caller</td><td>{@code *}</td><td>{@code name}</td></tr>
 *   <tr><td>{@code client:name}</td><td>query or caller</td><td>{@code client}</td><td>{@code name}</td></tr>
 *   <tr><td>{@code ws/client:name}</td><td>{@code ws}</td><td>{@code client}</td><td>{@code name}</td></tr>
 * </table>
 *
 * <p>
 * All functions are pure; nothing here touches the store.
 * </p>
 */
public final class AddressNormalizer {

    public static final String DEFAULT_SERVICE = "default";
    public static final String BUILT_IN_SERVICE = "built-in";
    public static final String PUBLIC = "public";
    public static final String PROTECTED = "protected";

    private static final Pattern ALLOWED_CHARACTERS = Pattern.compile("^[a-zA-Z0-9\\-_/*]*$");
    private static final String WILDCARD = ServiceIdentifier.WILDCARD;

    private AddressNormalizer() {
    }

    /**
     * Resolves a lookup against the caller's current workspace.
     *
     * @throws InvalidIdentifierException when the id repeats a separator, conflicts with the query's
     *                                    {@code client_id}/{@code app_id}, or holds disallowed characters
     */
    public static NormalizedQuery normalize(ServiceQuery query, String currentWorkspace) throws InvalidIdentifierException {
        String raw = query.getId() != null ? query.getId() : query.getServiceId();
        if (raw == null || raw.isBlank()) {
            raw = WILDCARD;
        }
        rejectRepeated(raw, '/');
        rejectRepeated(raw, ':');
        rejectRepeated(raw, '@');

        String name = raw;
        String appSuffix = null;
        int at = raw.indexOf('@');
        if (at >= 0) {
            name = raw.substring(0, at);
            appSuffix = raw.substring(at + 1);
            if (query.getAppId() != null && !query.getAppId().equals(appSuffix)) {
                throw new InvalidIdentifierException("App id mismatch: " + query.getAppId() + " != " + appSuffix);
            }
        }

        boolean hasSlash = name.indexOf('/') >= 0;
        boolean hasColon = name.indexOf(':') >= 0;
        String queryWorkspace = query.getWorkspace() != null ? query.getWorkspace() : currentWorkspace;
        String workspace;
        String clientId;
        String serviceId;
        boolean qualified = false;

        if (hasSlash && !hasColon) {
            workspace = before(name, '/');
            clientId = after(name, '/');
            serviceId = DEFAULT_SERVICE;
            if (query.getClientId() != null && !query.getClientId().equals(clientId)) {
                throw new InvalidIdentifierException(
                    "client_id (" + query.getClientId() + ") does not match service_id (" + name + ":" + DEFAULT_SERVICE + ")");
            }
        } else if (!hasSlash && !hasColon) {
            workspace = queryWorkspace;
            clientId = WILDCARD;
            serviceId = name;
        } else if (!hasSlash) {
            workspace = queryWorkspace;
            clientId = before(name, ':');
            serviceId = after(name, ':');
        } else {
            workspace = before(name, '/');
            String remainder = after(name, '/');
            if (remainder.indexOf(':') < 0) {
                throw new InvalidIdentifierException("Service id must put ':' after '/': " + raw);
            }
            clientId = before(remainder, ':');
            serviceId = after(remainder, ':');
            qualified = true;
        }

        boolean explicitAppId = appSuffix != null || query.getAppId() != null;
        String appId = appSuffix != null ? appSuffix : (query.getAppId() != null ? query.getAppId() : WILDCARD);

        String requestedVisibility = query.getVisibility() != null ? query.getVisibility() : WILDCARD;
        String visibility = WILDCARD.equals(workspace) ? PUBLIC : requestedVisibility;

        ServiceIdentifier address = new ServiceIdentifier(visibility, workspace, clientId, serviceId, appId);
        validateIdentifier(address);

        ServiceIdentifier callerScoped = null;
        if (WILDCARD.equals(workspace) && currentWorkspace != null) {
            callerScoped = new ServiceIdentifier(requestedVisibility, currentWorkspace, clientId, serviceId, appId);
            validateIdentifier(callerScoped);
        }

        boolean direct = qualified && !explicitAppId && !address.fullId().contains(WILDCARD);
        return new NormalizedQuery(address, callerScoped, direct, explicitAppId);
    }

    /**
     * Workspace and caller-supplied id a registration targets, before any shape validation. Access
     * rules are evaluated on this so a denied caller learns nothing about id syntax.
     */
    public static RegistrationId registrationScope(String rawId, String callerWorkspace) throws InvalidIdentifierException {
        if (rawId == null || rawId.isBlank()) {
            throw new InvalidIdentifierException("Service id is required");
        }
        if (isQualified(rawId)) {
            return new RegistrationId(before(rawId, '/'), after(rawId, '/'), rawId);
        }
        return new RegistrationId(callerWorkspace, rawId, callerWorkspace + "/" + rawId);
    }

    /**
     * Canonicalizes an id supplied to {@code register}. Ids already shaped {@code ws/client:service}
     * are reused as-is; anything else must be {@code built-in}, {@code default}, or end with
     * {@code :built-in} / {@code :default}, and is prefixed with the caller's workspace. A bare
     * reserved name is bound to the calling client.
     */
    public static RegistrationId canonicalizeForRegistration(String rawId, String callerWorkspace, String callerClientId)
        throws InvalidIdentifierException {
        if (rawId == null || rawId.isBlank()) {
            throw new InvalidIdentifierException("Service id is required");
        }
        rejectRepeated(rawId, '/');
        rejectRepeated(rawId, ':');
        if (rawId.indexOf('@') >= 0) {
            throw new InvalidIdentifierException("Service id must not contain '@'; pass the app id separately");
        }

        if (isQualified(rawId)) {
            String workspace = before(rawId, '/');
            String simpleId = after(rawId, '/');
            validateParts(rawId, workspace, before(simpleId, ':'), after(simpleId, ':'));
            return new RegistrationId(workspace, simpleId, rawId);
        }

        boolean reservedName = BUILT_IN_SERVICE.equals(rawId) || DEFAULT_SERVICE.equals(rawId);
        if (rawId.indexOf(':') < 0 && !reservedName) {
            throw new InvalidIdentifierException("Service id must contain ':'");
        }
        if (rawId.indexOf(':') >= 0 && !rawId.endsWith(":" + BUILT_IN_SERVICE) && !rawId.endsWith(":" + DEFAULT_SERVICE)) {
            throw new InvalidIdentifierException("Service id must not contain ':' except for :built-in and :default");
        }
        if (rawId.indexOf('/') >= 0) {
            throw new InvalidIdentifierException("Service id must not contain '/'");
        }

        String clientAndService = reservedName ? callerClientId + ":" + rawId : rawId;
        String fullId = callerWorkspace + "/" + clientAndService;
        validateParts(fullId, callerWorkspace, before(clientAndService, ':'), after(clientAndService, ':'));
        return new RegistrationId(callerWorkspace, rawId, fullId);
    }

    /**
     * Expands an id given to {@code unregister} into a store pattern spanning all visibilities.
     */
    public static String unregisterPattern(String serviceId, String callerWorkspace) throws InvalidIdentifierException {
        if (serviceId == null || serviceId.isBlank()) {
            throw new InvalidIdentifierException("Service id is required");
        }
        String id = serviceId.indexOf('/') >= 0 ? serviceId : callerWorkspace + "/" + serviceId;
        if (id.indexOf(':') < 0) {
            throw new InvalidIdentifierException("Service id info must contain ':'");
        }
        if (id.indexOf('@') < 0) {
            id = id + "@" + WILDCARD;
        }
        ServiceIdentifier parsed = ServiceIdentifier.fromStorageKey(ServiceIdentifier.KEY_PREFIX + WILDCARD + ":" + id);
        validateIdentifier(parsed);
        return parsed.storageKey();
    }

    /**
     * Turns a listing request into store patterns. A {@code null} query lists the caller's workspace.
     *
     * @throws InvalidQueryException for {@code id} combined with {@code service_id}, protected listings
     *                               across all workspaces, app id mismatches and disallowed characters
     */
    public static ListPlan planListing(ServiceQuery query, String currentWorkspace) throws InvalidQueryException {
        ServiceQuery effective = query == null
            ? ServiceQuery.builder().visibility(WILDCARD).workspace(currentWorkspace).clientId(WILDCARD).serviceId(WILDCARD).build()
            : query;
        if (effective.getId() != null) {
            if (effective.getServiceId() != null) {
                throw new InvalidQueryException("Cannot specify both 'id' and 'service_id' in the query.");
            }
            effective = effective.toBuilder().serviceId(effective.getId()).id(null).build();
        }

        String requestedVisibility = orWildcard(effective.getVisibility());
        String workspace = orWildcard(effective.getWorkspace());
        String visibility = requestedVisibility;
        if (WILDCARD.equals(workspace)) {
            if (PROTECTED.equals(requestedVisibility)) {
                throw new InvalidQueryException("Cannot list protected services in all workspaces.");
            }
            visibility = PUBLIC;
        }

        String clientId = orWildcard(effective.getClientId());
        String serviceId = orWildcard(effective.getServiceId());
        String appId = WILDCARD;
        int at = serviceId.indexOf('@');
        if (at >= 0) {
            appId = serviceId.substring(at + 1);
            serviceId = serviceId.substring(0, at);
            if (effective.getAppId() != null && !effective.getAppId().equals(appId)) {
                throw new InvalidQueryException("App id mismatch: " + effective.getAppId() + " != " + appId);
            }
        }
        if (effective.getAppId() != null) {
            appId = effective.getAppId();
        }

        for (String part : new String[] {visibility, workspace, clientId, serviceId, appId}) {
            if (!ALLOWED_CHARACTERS.matcher(part).matches()) {
                throw new InvalidQueryException("Invalid characters in query part: " + part);
            }
        }

        ServiceIdentifier pattern = new ServiceIdentifier(visibility, workspace, clientId, serviceId, appId);
        ServiceIdentifier callerScoped = WILDCARD.equals(workspace) && currentWorkspace != null
            ? new ServiceIdentifier(requestedVisibility, currentWorkspace, clientId, serviceId, appId)
            : null;
        return new ListPlan(pattern, callerScoped, effective.getType());
    }

    /**
     * Parses the string shorthand accepted by {@code list}: {@code ws/client:svc}, {@code client:svc},
     * {@code ws/svc} or a bare workspace. A {@code *} workspace reads as {@code public}.
     */
    public static ServiceQuery parseListShorthand(String shorthand) {
        String workspace = WILDCARD;
        String clientId = WILDCARD;
        String serviceId;
        boolean hasSlash = shorthand.indexOf('/') >= 0;
        boolean hasColon = shorthand.indexOf(':') >= 0;
        if (hasSlash && hasColon) {
            workspace = publicIfWildcard(before(shorthand, '/'));
            String remainder = after(shorthand, '/');
            clientId = before(remainder, ':');
            serviceId = emptyToWildcard(after(remainder, ':'));
        } else if (hasColon) {
            clientId = before(shorthand, ':');
            serviceId = emptyToWildcard(after(shorthand, ':'));
        } else if (hasSlash) {
            workspace = publicIfWildcard(before(shorthand, '/'));
            serviceId = emptyToWildcard(after(shorthand, '/'));
        } else {
            workspace = shorthand;
            serviceId = WILDCARD;
        }
        return ServiceQuery.builder()
            .visibility(WILDCARD)
            .workspace(workspace)
            .clientId(clientId)
            .serviceId(serviceId)
            .build();
    }

    /**
     * @return true for ids shaped {@code ws/client:service}.
     */
    public static boolean isQualified(String id) {
        int slash = id.indexOf('/');
        return slash >= 0 && id.indexOf(':') > slash && id.indexOf('/', slash + 1) < 0;
    }

    public static void validateIdentifier(ServiceIdentifier id) throws InvalidIdentifierException {
        for (String part : new String[] {id.visibility(), id.workspace(), id.clientId(), id.serviceId(), id.appId()}) {
            if (part.isEmpty()) {
                throw new InvalidIdentifierException("Service id has an empty part: " + id);
            }
            if (!ALLOWED_CHARACTERS.matcher(part).matches()) {
                throw new InvalidIdentifierException("Invalid characters in query part: " + part);
            }
        }
    }

    private static void validateParts(String id, String... parts) throws InvalidIdentifierException {
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new InvalidIdentifierException("Service id has an empty part: " + id);
            }
            if (!ALLOWED_CHARACTERS.matcher(part).matches()) {
                throw new InvalidIdentifierException("Invalid characters in service id: " + id);
            }
        }
    }

    private static void rejectRepeated(String id, char separator) throws InvalidIdentifierException {
        int first = id.indexOf(separator);
        if (first >= 0 && id.indexOf(separator, first + 1) >= 0) {
            throw new InvalidIdentifierException("Service id must contain at most one '" + separator + "'");
        }
    }

    private static String before(String value, char separator) {
        return value.substring(0, value.indexOf(separator));
    }

    private static String after(String value, char separator) {
        return value.substring(value.indexOf(separator) + 1);
    }

    private static String orWildcard(String value) {
        return value == null || value.isBlank() ? WILDCARD : value;
    }

    private static String emptyToWildcard(String value) {
        return value.isEmpty() ? WILDCARD : value;
    }

    private static String publicIfWildcard(String workspace) {
        return WILDCARD.equals(workspace) ? PUBLIC : workspace;
    }
}
