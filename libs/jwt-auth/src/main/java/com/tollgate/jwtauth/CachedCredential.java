package com.tollgate.jwtauth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A profile remembered for a token, with the instant it was produced.
 *
 * @param profile   the profile built when the token was last verified
 * @param createdAt when that verification completed
 */
public record CachedCredential(UserProfile profile, Instant createdAt) {

    public CachedCredential {
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    /**
     * Whether this entry may still be used at {@code now}.
     *
     * @param now the current instant
     * @param ttl maximum reuse period; null means entries never go stale
     * @return true while {@code now < createdAt + ttl}
     */
    public boolean isFresh(Instant now, Duration ttl) {
        return ttl == null || now.isBefore(createdAt.plus(ttl));
    }
}
