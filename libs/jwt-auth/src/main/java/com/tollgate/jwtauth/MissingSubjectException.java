package com.tollgate.jwtauth;

/**
 * Thrown when the configured subject claim is absent or is not a string.
 */
public class MissingSubjectException extends TokenAuthenticationException {

    private final String subjectClaim;

    public MissingSubjectException(String subjectClaim) {
        super("JWT claims do not contain string claim '%s'".formatted(subjectClaim));
        this.subjectClaim = subjectClaim;
    }

    public String subjectClaim() {
        return subjectClaim;
    }
}
