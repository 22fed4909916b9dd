package com.tollgate.jwtauth;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Maps a claims map to a {@link UserProfile}.
 * <p>
 * The configured subject claim becomes both the id and the display name. When an enricher is
 * present it is given the full claims to add extension attributes.
 */
public final class IdentityMapper {

    /** Provider tag carried by every profile this mapper builds. */
    public static final String PROVIDER = "JWT";

    private final String subjectClaim;
    private final UserProfileEnricher enricher;

    /**
     * @param subjectClaim name of the claim holding the bearer's identity
     * @param enricher     optional hook, may be null
     */
    public IdentityMapper(String subjectClaim, UserProfileEnricher enricher) {
        this.subjectClaim = Objects.requireNonNull(subjectClaim, "subjectClaim must not be null");
        this.enricher = enricher;
    }

    /**
     * Builds a profile from verified claims.
     *
     * @throws MissingSubjectException if the subject claim is absent or not a string
     */
    public UserProfile map(Map<String, ?> claims) {
        if (!(claims.get(subjectClaim) instanceof String subject)) {
            throw new MissingSubjectException(subjectClaim);
        }
        UserProfile.Builder builder = UserProfile.builder(subject, PROVIDER);
        if (enricher != null) {
            enricher.enrich(builder, Collections.<String, Object>unmodifiableMap(claims));
        }
        return builder.build();
    }

    public String subjectClaim() {
        return subjectClaim;
    }
}
