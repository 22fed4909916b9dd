package com.tollgate.jwtauth;

/**
 * Base type for every reason a bearer token can be rejected.
 * <p>
 * Unchecked: these never escape {@link JwtAuthenticator}, which turns each of them into a
 * single failure outcome. Callers using the codec or extractor directly may still catch them.
 */
public class TokenAuthenticationException extends RuntimeException {

    public TokenAuthenticationException(String message) {
        super(message);
    }

    public TokenAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
