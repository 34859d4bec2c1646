package io.hypha.core.auth;

public final class TokenSignatureException extends TokenVerificationException {

    private static final long serialVersionUID = 1L;

    public TokenSignatureException(String message) {
        super(message);
    }
}
