package io.hypha.core.auth;

/**
 * The token carried an {@code exp} claim that lies in the past.
 */
public final class TokenExpiredException extends TokenVerificationException {

    private static final long serialVersionUID = 1L;

    private final long expiresAtUnix;

    public TokenExpiredException(long expiresAtUnix) {
        super("Token expired at " + expiresAtUnix);
        this.expiresAtUnix = expiresAtUnix;
    }

    public long getExpiresAtUnix() {
        return expiresAtUnix;
    }
}
