package com.tollgate.jwtauth;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Objects;

/**
 * Decorates a {@link TokenVerifier} so that a token is only valid if its claims also bind to
 * a Java claims type.
 * <p>
 * Unknown claims are ignored; type mismatches on declared properties reject the token.
 *
 * @param <C> the claims type, a record or bean Jackson can construct
 */
public final class TypedClaimsVerifier<C> implements TokenVerifier {

    private static final ObjectMapper MAPPER = ClaimsExtractor.objectMapper().copy()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final TokenVerifier signatureVerifier;
    private final Class<C> claimsType;

    public TypedClaimsVerifier(TokenVerifier signatureVerifier, Class<C> claimsType) {
        this.signatureVerifier = Objects.requireNonNull(signatureVerifier, "signatureVerifier must not be null");
        this.claimsType = Objects.requireNonNull(claimsType, "claimsType must not be null");
    }

    @Override
    public void verify(String token) {
        signatureVerifier.verify(token);
        bind(token);
    }

    /**
     * Decodes the token's claims into {@code C}.
     *
     * @throws TokenVerificationException if the claims cannot be read as {@code C}
     */
    public C bind(String token) {
        Map<String, Object> claims;
        try {
            claims = ClaimsExtractor.extract(token);
        } catch (TokenAuthenticationException e) {
            throw new TokenVerificationException("Claims cannot be decoded: " + e.getMessage(), e);
        }
        try {
            return MAPPER.convertValue(claims, claimsType);
        } catch (IllegalArgumentException e) {
            throw new TokenVerificationException(
                    "Claims do not match " + claimsType.getSimpleName(), e);
        }
    }
}
