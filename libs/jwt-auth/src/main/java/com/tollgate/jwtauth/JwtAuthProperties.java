package com.tollgate.jwtauth;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Settings bound from {@code tollgate.jwt.*}.
 *
 * <pre>{@code
 * tollgate:
 *   jwt:
 *     subject-claim: email
 *     token-ttl: 5m            # 300 (seconds), 300s and PT5M are equivalent
 *     cache-maximum-size: 50000
 * }</pre>
 *
 * @param enabled          whether {@link JwtAuthConfiguration} registers its beans
 * @param subjectClaim     claim holding the bearer's identity
 * @param tokenTtl         how long a verified token is reused from the cache; absent means forever
 * @param cacheMaximumSize upper bound on cached tokens
 */
@Validated
@ConfigurationProperties(prefix = "tollgate.jwt")
public record JwtAuthProperties(
        Boolean enabled,
        @NotBlank String subjectClaim,
        @DurationUnit(ChronoUnit.SECONDS) @DurationMin(seconds = 1) Duration tokenTtl,
        @Positive Long cacheMaximumSize
) {

    public JwtAuthProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (subjectClaim == null || subjectClaim.isBlank()) {
            subjectClaim = JwtAuthenticatorOptions.DEFAULT_SUBJECT_CLAIM;
        }
        if (cacheMaximumSize == null) {
            cacheMaximumSize = CaffeineCredentialCache.DEFAULT_MAXIMUM_SIZE;
        }
    }

    /** Authenticator options for these settings, with the given enricher (may be null). */
    public JwtAuthenticatorOptions toOptions(UserProfileEnricher profileEnricher) {
        return new JwtAuthenticatorOptions(subjectClaim, tokenTtl, profileEnricher);
    }
}
