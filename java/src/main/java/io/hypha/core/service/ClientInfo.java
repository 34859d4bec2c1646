package io.hypha.core.service;

/**
 * Payload of {@code client_connected}, {@code client_updated} and {@code client_disconnected} events.
 */
public record ClientInfo(String id, String workspace) {
}
