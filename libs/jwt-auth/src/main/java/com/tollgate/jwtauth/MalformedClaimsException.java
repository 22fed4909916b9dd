package com.tollgate.jwtauth;

/**
 * Thrown when the claims segment decodes to something other than a JSON object.
 */
public class MalformedClaimsException extends TokenAuthenticationException {

    public MalformedClaimsException(String message) {
        super(message);
    }

    public MalformedClaimsException(String message, Throwable cause) {
        super(message, cause);
    }
}
