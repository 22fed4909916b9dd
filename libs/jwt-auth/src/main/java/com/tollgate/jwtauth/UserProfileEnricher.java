package com.tollgate.jwtauth;

import java.util.Map;

/**
 * Optional hook that copies additional claims onto a profile as extension attributes.
 * <p>
 * Called once per fresh verification, never for cache hits. It only sees a
 * {@link UserProfile.Builder}, so the id, display name and provider cannot be changed.
 */
@FunctionalInterface
public interface UserProfileEnricher {

    /**
     * @param profile the profile under construction
     * @param claims  every claim of the verified token (read-only)
     */
    void enrich(UserProfile.Builder profile, Map<String, Object> claims);
}
