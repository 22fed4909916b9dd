package com.tollgate.jwtauth;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer meters for a {@link JwtAuthenticator}.
 * <p>
 * Every meter carries an {@code authenticator} tag with the authenticator's name so that
 * several authenticators can share one registry.
 */
public final class AuthenticationMetrics {

    public static final String AUTHENTICATIONS = "tollgate.jwt.authentications";
    public static final String CACHE = "tollgate.jwt.cache";
    public static final String VERIFICATION = "tollgate.jwt.verification";

    public static final String TAG_AUTHENTICATOR = "authenticator";
    public static final String TAG_OUTCOME = "outcome";
    public static final String TAG_RESULT = "result";

    private final MeterRegistry registry;
    private final Counter success;
    private final Counter failure;
    private final Counter pass;
    private final Counter cacheHit;
    private final Counter cacheMiss;
    private final Counter cacheStale;
    private final Timer verification;

    /**
     * @param registry          the registry to publish to
     * @param authenticatorName value of the {@code authenticator} tag
     */
    public AuthenticationMetrics(MeterRegistry registry, String authenticatorName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (authenticatorName == null || authenticatorName.isBlank()) {
            throw new IllegalArgumentException("authenticatorName must not be null or blank");
        }
        this.registry = registry;
        Tags base = Tags.of(TAG_AUTHENTICATOR, authenticatorName);
        this.success = counter(AUTHENTICATIONS, "Authentication attempts by outcome", base.and(TAG_OUTCOME, "success"));
        this.failure = counter(AUTHENTICATIONS, "Authentication attempts by outcome", base.and(TAG_OUTCOME, "failure"));
        this.pass = counter(AUTHENTICATIONS, "Authentication attempts by outcome", base.and(TAG_OUTCOME, "pass"));
        this.cacheHit = counter(CACHE, "Credential cache lookups by result", base.and(TAG_RESULT, "hit"));
        this.cacheMiss = counter(CACHE, "Credential cache lookups by result", base.and(TAG_RESULT, "miss"));
        this.cacheStale = counter(CACHE, "Credential cache lookups by result", base.and(TAG_RESULT, "stale"));
        this.verification = Timer.builder(VERIFICATION)
                .description("Time spent in the token verifier")
                .tags(base)
                .register(registry);
    }

    /** Metrics published to Micrometer's global registry. */
    public static AuthenticationMetrics global(String authenticatorName) {
        return new AuthenticationMetrics(Metrics.globalRegistry, authenticatorName);
    }

    void recordSuccess() {
        success.increment();
    }

    void recordFailure() {
        failure.increment();
    }

    void recordPass() {
        pass.increment();
    }

    void recordCacheHit() {
        cacheHit.increment();
    }

    void recordCacheMiss() {
        cacheMiss.increment();
    }

    void recordCacheStale() {
        cacheStale.increment();
    }

    void timeVerification(Runnable call) {
        verification.record(call);
    }

    private Counter counter(String name, String description, Tags tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tags)
                .register(registry);
    }
}
