package com.tollgate.jwtauth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Turns an Authorization header value into a raw token.
 */
public final class BearerTokenExtractor {

    static final String BEARER = "Bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Strips a leading {@code "Bearer"} followed by whitespace; any other value is returned
     * verbatim as the token. The prefix is matched case-sensitively.
     *
     * @param authorizationHeader the header value (may be null)
     * @return the token, or empty if the header is missing or holds no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isEmpty()) {
            return Optional.empty();
        }
        if (authorizationHeader.startsWith(BEARER)
                && authorizationHeader.length() > BEARER.length()
                && Character.isWhitespace(authorizationHeader.charAt(BEARER.length()))) {
            String token = authorizationHeader.substring(BEARER.length()).strip();
            return token.isEmpty() ? Optional.empty() : Optional.of(token);
        }
        return Optional.of(authorizationHeader);
    }

    /**
     * Short, non-reversible identifier of a token for log lines.
     */
    public static String fingerprint(String token) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
