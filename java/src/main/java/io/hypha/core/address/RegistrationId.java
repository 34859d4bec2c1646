package io.hypha.core.address;

/**
 * Canonical form of an id supplied at registration time.
 *
 * @param workspace workspace the service lands in
 * @param simpleId  id without the workspace prefix ({@code client:service}, or a bare reserved name)
 * @param fullId    {@code workspace/client:service}
 */
public record RegistrationId(String workspace, String simpleId, String fullId) {
}
