package io.hypha.core.auth;

import io.hypha.core.HyphaException;

/**
 * Base type for failures while verifying a signed token.
 */
public class TokenVerificationException extends HyphaException {

    private static final long serialVersionUID = 1L;

    public TokenVerificationException(String message) {
        super(message);
    }

    public TokenVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
