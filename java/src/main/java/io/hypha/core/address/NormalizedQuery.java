package io.hypha.core.address;

/**
 * Result of normalizing a lookup.
 *
 * @param address        pattern (or exact address) to search for
 * @param callerScoped   extra pattern scoped to the caller's workspace, only set when {@code address}
 *                       spans every workspace
 * @param direct         the address is fully qualified without wildcards and can be fetched directly
 * @param explicitAppId  the caller named an app id, either as an {@code @} suffix or a query field
 */
public record NormalizedQuery(
    ServiceIdentifier address,
    ServiceIdentifier callerScoped,
    boolean direct,
    boolean explicitAppId
) {

    /**
     * @return true when a non-wildcard app id was requested, which makes on-demand launch possible.
     */
    public boolean launchable() {
        return explicitAppId && !ServiceIdentifier.WILDCARD.equals(address.appId());
    }
}
