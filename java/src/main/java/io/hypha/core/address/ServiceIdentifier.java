package io.hypha.core.address;

import io.hypha.core.InvalidIdentifierException;

import java.util.Objects;

/**
 * Fully qualified service address. Renders to the wire form
 * {@code <workspace>/<client_id>:<service_id>@<app_id>} and to the storage key
 * {@code services:<visibility>:<workspace>/<client_id>:<service_id>@<app_id>}.
 */
public record ServiceIdentifier(
    String visibility,
    String workspace,
    String clientId,
    String serviceId,
    String appId
) {

    public static final String KEY_PREFIX = "services:";
    public static final String WILDCARD = "*";

    public ServiceIdentifier {
        Objects.requireNonNull(visibility, "visibility");
        Objects.requireNonNull(workspace, "workspace");
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(serviceId, "serviceId");
        Objects.requireNonNull(appId, "appId");
    }

    /**
     * @return {@code <workspace>/<client_id>:<service_id>}, the id used by the RPC transport.
     */
    public String fullId() {
        return workspace + "/" + clientId + ":" + serviceId;
    }

    public String storageKey() {
        return KEY_PREFIX + visibility + ":" + fullId() + "@" + appId;
    }

    /**
     * Parses a storage key produced by {@link #storageKey()}.
     */
    public static ServiceIdentifier fromStorageKey(String key) throws InvalidIdentifierException {
        if (key == null || !key.startsWith(KEY_PREFIX)) {
            throw new InvalidIdentifierException("Storage key must start with '" + KEY_PREFIX + "': " + key);
        }
        String rest = key.substring(KEY_PREFIX.length());
        int visibilityEnd = rest.indexOf(':');
        int slash = rest.indexOf('/');
        if (visibilityEnd < 0 || slash < visibilityEnd) {
            throw new InvalidIdentifierException("Malformed storage key: " + key);
        }
        String visibility = rest.substring(0, visibilityEnd);
        String address = rest.substring(visibilityEnd + 1);
        int addressSlash = address.indexOf('/');
        int colon = address.indexOf(':', addressSlash + 1);
        int at = address.lastIndexOf('@');
        if (addressSlash < 0 || colon < 0 || at < colon) {
            throw new InvalidIdentifierException("Malformed storage key: " + key);
        }
        return new ServiceIdentifier(
            visibility,
            address.substring(0, addressSlash),
            address.substring(addressSlash + 1, colon),
            address.substring(colon + 1, at),
            address.substring(at + 1)
        );
    }

    @Override
    public String toString() {
        return fullId() + "@" + appId;
    }
}
