package io.hypha.core.transport;

import io.hypha.core.HyphaException;
import io.hypha.core.service.ServiceHandle;
import io.hypha.core.service.ServiceImplementation;
import io.hypha.core.service.ServiceRecord;
import io.hypha.core.spi.RemoteTransport;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves services whose implementation lives in this process and forwards every other id to a
 * downstream transport.
 */
public final class InProcessTransport implements RemoteTransport {

    private final Map<String, ServiceHandle> local = new ConcurrentHashMap<>();
    private final RemoteTransport downstream;

    public InProcessTransport() {
        this(null);
    }

    /**
     * @param downstream transport for ids not bound locally; {@code null} answers them with {@code null}
     */
    public InProcessTransport(RemoteTransport downstream) {
        this.downstream = downstream;
    }

    /**
     * Binds a canonical record. Only {@link ServiceImplementation.Local} records are served from here.
     *
     * @return true when the record was bound.
     */
    public boolean bind(ServiceRecord record) {
        Objects.requireNonNull(record, "record");
        if (!(record.implementation() instanceof ServiceImplementation.Local)) {
            return false;
        }
        local.put(record.id(), ServiceHandle.fromRecord(record));
        return true;
    }

    public boolean unbind(String serviceId) {
        return local.remove(serviceId) != null;
    }

    public boolean isBound(String serviceId) {
        return local.containsKey(serviceId);
    }

    @Override
    public ServiceHandle getRemoteService(String serviceId, Duration timeout) throws HyphaException {
        Objects.requireNonNull(serviceId, "serviceId");
        ServiceHandle handle = local.get(serviceId);
        if (handle != null) {
            return handle;
        }
        if (downstream == null) {
            return null;
        }
        return downstream.getRemoteService(serviceId, timeout);
    }
}
