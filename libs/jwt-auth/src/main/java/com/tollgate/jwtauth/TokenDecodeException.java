package com.tollgate.jwtauth;

/**
 * Thrown when a token segment is not valid base64url.
 */
public class TokenDecodeException extends TokenAuthenticationException {

    public TokenDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
