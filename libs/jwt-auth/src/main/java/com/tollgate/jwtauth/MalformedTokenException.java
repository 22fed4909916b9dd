package com.tollgate.jwtauth;

/**
 * Thrown when a token does not split into two (unsigned) or three (signed) segments.
 */
public class MalformedTokenException extends TokenAuthenticationException {

    private final int segmentCount;

    public MalformedTokenException(int segmentCount) {
        super("Token must have 2 or 3 segments but had %d".formatted(segmentCount));
        this.segmentCount = segmentCount;
    }

    public int segmentCount() {
        return segmentCount;
    }
}
