package io.hypha.core;

/**
 * Base exception thrown by the Hypha core.
 */
public class HyphaException extends Exception {

    private static final long serialVersionUID = 1L;

    public HyphaException(String message) {
        super(message);
    }

    public HyphaException(String message, Throwable cause) {
        super(message, cause);
    }
}
