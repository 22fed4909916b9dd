package com.tollgate.jwtauth;

/**
 * Thrown by a {@link TokenVerifier} when a token's signature or claims are rejected.
 */
public class TokenVerificationException extends TokenAuthenticationException {

    public TokenVerificationException(String message) {
        super(message);
    }

    public TokenVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
