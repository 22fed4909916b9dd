package com.tollgate.jwtauth;

import java.util.Optional;

/**
 * Key/value store of previously verified tokens.
 * <p>
 * Keys are the exact token strings, after any {@code Bearer} prefix has been removed.
 * Implementations must be safe for concurrent use; {@link #store} is last-writer-wins. A cache
 * never verifies anything and never expires entries by age: staleness is decided by the
 * caller from {@link CachedCredential#createdAt()}. Capacity-based eviction is allowed.
 */
public interface CredentialCache {

    /** Returns the entry for the token, stale or not. */
    Optional<CachedCredential> lookup(String token);

    /** Creates or replaces the entry for the token, stamped with the current time. */
    void store(String token, UserProfile profile);

    /** Approximate number of entries held. */
    long size();
}
