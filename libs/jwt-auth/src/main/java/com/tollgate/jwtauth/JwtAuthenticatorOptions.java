package com.tollgate.jwtauth;

import java.time.Duration;
import java.util.Optional;

/**
 * Immutable settings of a {@link JwtAuthenticator}.
 * <p>
 * Built in code, or from {@code tollgate.jwt.*} properties through
 * {@link JwtAuthProperties#toOptions(UserProfileEnricher)}.
 *
 * @param subjectClaim    claim holding the bearer's identity; defaults to {@code "sub"}
 * @param tokenTimeToLive how long a verified token is reused from the cache; null means
 *                        forever
 * @param profileEnricher optional hook adding extension attributes to new profiles
 */
public record JwtAuthenticatorOptions(
        String subjectClaim,
        Duration tokenTimeToLive,
        UserProfileEnricher profileEnricher
) {

    public static final String DEFAULT_SUBJECT_CLAIM = "sub";

    /**
     * Compact constructor: applies the subject claim default and rejects non-positive TTLs.
     */
    public JwtAuthenticatorOptions {
        if (subjectClaim == null || subjectClaim.isBlank()) {
            subjectClaim = DEFAULT_SUBJECT_CLAIM;
        }
        if (tokenTimeToLive != null && (tokenTimeToLive.isZero() || tokenTimeToLive.isNegative())) {
            throw new IllegalArgumentException("tokenTimeToLive must be positive, got: " + tokenTimeToLive);
        }
    }

    /** Subject {@code sub}, cache forever, no enricher. */
    public static JwtAuthenticatorOptions defaults() {
        return new JwtAuthenticatorOptions(null, null, null);
    }

    public JwtAuthenticatorOptions withSubjectClaim(String subjectClaim) {
        return new JwtAuthenticatorOptions(subjectClaim, tokenTimeToLive, profileEnricher);
    }

    public JwtAuthenticatorOptions withTokenTimeToLive(Duration tokenTimeToLive) {
        return new JwtAuthenticatorOptions(subjectClaim, tokenTimeToLive, profileEnricher);
    }

    public JwtAuthenticatorOptions withProfileEnricher(UserProfileEnricher profileEnricher) {
        return new JwtAuthenticatorOptions(subjectClaim, tokenTimeToLive, profileEnricher);
    }

    /** The TTL, if one is configured. */
    public Optional<Duration> timeToLive() {
        return Optional.ofNullable(tokenTimeToLive);
    }
}
