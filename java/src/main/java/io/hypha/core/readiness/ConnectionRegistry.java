package io.hypha.core.readiness;

import io.hypha.core.HyphaException;
import io.hypha.core.events.EventBus;
import io.hypha.core.events.Events;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Open connections of this process. Records live only as long as the connection.
 */
public final class ConnectionRegistry {

    private static final Logger LOGGER = Logger.getLogger(ConnectionRegistry.class.getName());

    private final Map<String, ConnectionRecord> connections = new ConcurrentHashMap<>();
    private final EventBus eventBus;

    public ConnectionRegistry(EventBus eventBus) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    }

    /**
     * @throws HyphaException when a connection with the same id is already open
     */
    public ConnectionRecord open(String id, String workspace, String source, MessageSink sink) throws HyphaException {
        ConnectionRecord record = new ConnectionRecord(id, workspace, source, sink);
        if (connections.putIfAbsent(id, record) != null) {
            throw new HyphaException("connection " + id + " is already open");
        }
        LOGGER.fine(() -> "[hypha-core] opened connection " + id + " in " + workspace);
        return record;
    }

    public ConnectionRecord get(String id) {
        return connections.get(id);
    }

    /**
     * Announces that the peer finished its handshake by emitting {@code connection_ready}.
     */
    public ConnectionRecord markReady(String id) throws HyphaException {
        ConnectionRecord record = require(id);
        eventBus.emit(Events.CONNECTION_READY, record);
        return record;
    }

    public void send(String id, Map<String, Object> message) throws HyphaException {
        require(id).sink().send(message);
    }

    public boolean close(String id) {
        ConnectionRecord removed = connections.remove(id);
        if (removed == null) {
            return false;
        }
        LOGGER.fine(() -> "[hypha-core] closed connection " + id);
        return true;
    }

    /**
     * @return open connections, sorted by id.
     */
    public List<ConnectionRecord> list() {
        return connections.values().stream()
            .sorted((a, b) -> a.id().compareTo(b.id()))
            .collect(Collectors.toList());
    }

    private ConnectionRecord require(String id) throws HyphaException {
        ConnectionRecord record = connections.get(id);
        if (record == null) {
            throw new HyphaException("connection " + id + " is not open");
        }
        return record;
    }
}
