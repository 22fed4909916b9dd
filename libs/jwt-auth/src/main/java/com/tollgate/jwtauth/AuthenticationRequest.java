package com.tollgate.jwtauth;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The parts of an inbound request an authenticator reads.
 * <p>
 * The routing layer adapts its own request type to this interface. Header names are
 * case-insensitive, values are returned verbatim.
 */
@FunctionalInterface
public interface AuthenticationRequest {

    /** Returns the first value of the named header, if present. */
    Optional<String> header(String name);

    /**
     * Request view over a header map, matching names case-insensitively.
     */
    static AuthenticationRequest ofHeaders(Map<String, String> headers) {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        return name -> Optional.ofNullable(copy.get(name));
    }
}
