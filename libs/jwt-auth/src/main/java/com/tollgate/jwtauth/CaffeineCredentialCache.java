package com.tollgate.jwtauth;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Size-bounded {@link CredentialCache} backed by Caffeine.
 * <p>
 * Only capacity eviction is configured, never time-based expiry. Token lifetime is checked by
 * {@link JwtAuthenticator} against {@link CachedCredential#createdAt()}.
 */
public final class CaffeineCredentialCache implements CredentialCache {

    /** Default upper bound on cached tokens. */
    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final Cache<String, CachedCredential> cache;
    private final Clock clock;

    public CaffeineCredentialCache() {
        this(DEFAULT_MAXIMUM_SIZE, Clock.systemUTC());
    }

    /**
     * @param maximumSize maximum number of tokens held (must be positive)
     * @param clock       source of {@code createdAt} timestamps
     */
    public CaffeineCredentialCache(long maximumSize, Clock clock) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive, got: " + maximumSize);
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public Optional<CachedCredential> lookup(String token) {
        return Optional.ofNullable(cache.getIfPresent(token));
    }

    @Override
    public void store(String token, UserProfile profile) {
        cache.put(token, new CachedCredential(profile, clock.instant()));
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    /** Runs pending maintenance such as size eviction. */
    void cleanUp() {
        cache.cleanUp();
    }
}
