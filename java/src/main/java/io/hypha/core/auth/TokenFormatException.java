package io.hypha.core.auth;

/**
 * The token is not three base64url segments carrying an HS256 header and JSON claims.
 */
public final class TokenFormatException extends TokenVerificationException {

    private static final long serialVersionUID = 1L;

    public TokenFormatException(String message) {
        super(message);
    }

    public TokenFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
