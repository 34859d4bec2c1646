package io.hypha.core;

/**
 * Raised when a service id or query has a malformed shape.
 */
public final class InvalidIdentifierException extends HyphaException {

    private static final long serialVersionUID = 1L;

    public InvalidIdentifierException(String message) {
        super(message);
    }
}
