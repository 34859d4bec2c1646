package io.hypha.core.events;

/**
 * Event names emitted on the {@link EventBus}.
 */
public final class Events {

    public static final String SERVICE_ADDED = "service_added";
    public static final String SERVICE_UPDATED = "service_updated";
    public static final String SERVICE_REMOVED = "service_removed";
    public static final String CLIENT_CONNECTED = "client_connected";
    public static final String CLIENT_UPDATED = "client_updated";
    public static final String CLIENT_DISCONNECTED = "client_disconnected";
    public static final String CLIENT_READY = "client_ready";
    public static final String CONNECTION_READY = "connection_ready";

    private Events() {
    }
}
