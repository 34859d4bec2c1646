package io.hypha.core.spi;

import io.hypha.core.CallerContext;
import io.hypha.core.HyphaException;
import io.hypha.core.address.ServiceIdentifier;

/**
 * Materializes a new app instance when a lookup for an explicit app id finds nothing.
 */
@FunctionalInterface
public interface AppLauncher {

    AppLauncher NONE = (address, context) -> {
    };

    /**
     * Launches the app named by {@code address.appId()} and returns once its services are registered.
     */
    void launch(ServiceIdentifier address, CallerContext context) throws HyphaException;
}
