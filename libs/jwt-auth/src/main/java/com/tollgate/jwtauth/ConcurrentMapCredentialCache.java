package com.tollgate.jwtauth;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Unbounded {@link CredentialCache} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Entries live until overwritten. Suitable when the set of distinct tokens is naturally
 * small; otherwise prefer {@link CaffeineCredentialCache}.
 */
public final class ConcurrentMapCredentialCache implements CredentialCache {

    private final ConcurrentMap<String, CachedCredential> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public ConcurrentMapCredentialCache() {
        this(Clock.systemUTC());
    }

    public ConcurrentMapCredentialCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<CachedCredential> lookup(String token) {
        return Optional.ofNullable(entries.get(token));
    }

    @Override
    public void store(String token, UserProfile profile) {
        entries.put(token, new CachedCredential(profile, clock.instant()));
    }

    @Override
    public long size() {
        return entries.size();
    }
}
