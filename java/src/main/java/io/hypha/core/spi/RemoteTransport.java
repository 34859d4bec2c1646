package io.hypha.core.spi;

import io.hypha.core.HyphaException;
import io.hypha.core.ServiceTimeoutException;
import io.hypha.core.service.ServiceHandle;

import java.time.Duration;

/**
 * RPC transport used to obtain callable handles for fully qualified service ids.
 */
public interface RemoteTransport {

    /**
     * @param serviceId fully qualified id, {@code workspace/client:service}
     * @param timeout   upper bound for the fetch
     * @return the handle, or {@code null} when the service does not exist
     * @throws ServiceTimeoutException when the peer does not answer in time
     */
    ServiceHandle getRemoteService(String serviceId, Duration timeout) throws HyphaException;
}
