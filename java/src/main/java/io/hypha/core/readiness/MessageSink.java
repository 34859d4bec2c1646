package io.hypha.core.readiness;

import io.hypha.core.HyphaException;

import java.util.Map;

/**
 * Outbound channel of a connection, such as a websocket or a sandboxed page.
 */
@FunctionalInterface
public interface MessageSink {

    void send(Map<String, Object> message) throws HyphaException;
}
