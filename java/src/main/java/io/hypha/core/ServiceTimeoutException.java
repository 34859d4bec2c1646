package io.hypha.core;

import java.time.Duration;

/**
 * Raised when a bounded wait (remote fetch or readiness handshake) runs out of time.
 */
public final class ServiceTimeoutException extends HyphaException {

    private static final long serialVersionUID = 1L;

    private final String target;
    private final Duration timeout;

    public ServiceTimeoutException(String target, Duration timeout) {
        super(defaultMessage(target, timeout));
        this.target = target;
        this.timeout = timeout;
    }

    public ServiceTimeoutException(String target, Duration timeout, Throwable cause) {
        super(defaultMessage(target, timeout), cause);
        this.target = target;
        this.timeout = timeout;
    }

    public String getTarget() {
        return target;
    }

    public Duration getTimeout() {
        return timeout;
    }

    private static String defaultMessage(String target, Duration timeout) {
        double seconds = timeout == null ? 0d : timeout.toMillis() / 1000d;
        return "Timeout after " + seconds + " s waiting for " + target;
    }
}
