package io.hypha.core;

/**
 * Raised for disallowed query keys or an unsupported visibility/workspace combination.
 */
public final class InvalidQueryException extends HyphaException {

    private static final long serialVersionUID = 1L;

    public InvalidQueryException(String message) {
        super(message);
    }
}
