package com.tollgate.jwtauth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.JWTVerifier;

import java.util.Objects;

/**
 * {@link TokenVerifier} backed by the auth0 java-jwt library.
 * <p>
 * The wrapped verifier checks the signature and any registered claims it was built to require
 * (issuer, audience, expiry...).
 */
public final class Auth0TokenVerifier implements TokenVerifier {

    private final JWTVerifier delegate;

    public Auth0TokenVerifier(JWTVerifier delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    /**
     * Verifier for tokens signed with HMAC-SHA256 under the given secret.
     */
    public static Auth0TokenVerifier hmac256(byte[] secret) {
        return new Auth0TokenVerifier(JWT.require(Algorithm.HMAC256(secret)).build());
    }

    /**
     * Verifier for any algorithm the library supports.
     */
    public static Auth0TokenVerifier of(Algorithm algorithm) {
        return new Auth0TokenVerifier(JWT.require(algorithm).build());
    }

    @Override
    public void verify(String token) {
        try {
            delegate.verify(token);
        } catch (JWTVerificationException e) {
            throw new TokenVerificationException(e.getMessage(), e);
        }
    }
}
