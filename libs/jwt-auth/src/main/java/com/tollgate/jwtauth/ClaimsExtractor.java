package com.tollgate.jwtauth;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Map;

/**
 * Reads the claims segment of a token into a generic key/value map.
 * <p>
 * Works independently of any {@link TokenVerifier}: it never checks the signature, it only
 * decodes the middle segment. Values keep their JSON shape (strings, numbers, booleans, lists,
 * nested maps).
 */
public final class ClaimsExtractor {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {
    };

    private ClaimsExtractor() {
        // utility class
    }

    /**
     * Extracts the claims of a {@code header.claims[.signature]} token.
     *
     * @param token the raw token, without any scheme prefix
     * @return the claims as an insertion-ordered map
     * @throws MalformedTokenException  if the token does not have 2 or 3 segments
     * @throws TokenDecodeException     if the claims segment is not base64url
     * @throws MalformedClaimsException if the decoded bytes are not a JSON object
     */
    public static Map<String, Object> extract(String token) {
        String[] segments = token.split("\\.", -1);
        if (segments.length != 2 && segments.length != 3) {
            throw new MalformedTokenException(segments.length);
        }
        return parseClaims(Base64Url.decode(segments[1]));
    }

    /**
     * Parses a decoded claims payload.
     *
     * @throws MalformedClaimsException if the payload is not a JSON object
     */
    static Map<String, Object> parseClaims(byte[] json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new MalformedClaimsException("Claims segment is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedClaimsException("Claims segment is not a JSON object");
        }
        return MAPPER.convertValue(node, CLAIMS_TYPE);
    }

    /** Returns the shared ObjectMapper used for claims (for verifiers binding typed claims). */
    static ObjectMapper objectMapper() {
        return MAPPER;
    }
}
