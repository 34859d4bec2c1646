package io.hypha.core.readiness;

import java.util.Objects;

/**
 * Ephemeral record of an open client connection.
 *
 * @param id         connection id, usually the client id the peer will register under
 * @param workspace  workspace the connection belongs to
 * @param source     free-form origin description (plugin url, socket address)
 * @param sink       channel used to push messages to the peer
 */
public record ConnectionRecord(String id, String workspace, String source, MessageSink sink) {

    public ConnectionRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(workspace, "workspace");
        Objects.requireNonNull(sink, "sink");
    }
}
