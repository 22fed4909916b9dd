package com.tollgate.jwtauth;

/**
 * Proves that a token is authentic before its claims are trusted.
 * <p>
 * Implementations own the algorithm and key material. They must be side-effect free and
 * thread-safe; {@link JwtAuthenticator} may call them concurrently for the same token.
 */
@FunctionalInterface
public interface TokenVerifier {

    /**
     * Returns normally if the token is valid.
     *
     * @param token the raw token, without scheme prefix
     * @throws TokenVerificationException if the signature or claims are rejected
     */
    void verify(String token) throws TokenVerificationException;
}
