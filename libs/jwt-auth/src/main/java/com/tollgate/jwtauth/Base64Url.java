package com.tollgate.jwtauth;

import java.util.Base64;

/**
 * Base64url encoding as used inside JWT segments: {@code -} and {@code _} instead of
 * {@code +} and {@code /}, with the trailing {@code =} padding removed.
 * <p>
 * Implemented on top of the standard alphabet so that decoding tolerates input whose
 * padding was stripped.
 */
public final class Base64Url {

    private Base64Url() {
        // utility class
    }

    /**
     * Encodes bytes to an unpadded base64url string.
     *
     * @param data the bytes to encode (must not be null)
     * @return a string containing none of {@code +}, {@code /} or {@code =}
     */
    public static String encode(byte[] data) {
        String standard = Base64.getEncoder().encodeToString(data);
        StringBuilder out = new StringBuilder(standard.length());
        for (int i = 0; i < standard.length(); i++) {
            char c = standard.charAt(i);
            switch (c) {
                case '+' -> out.append('-');
                case '/' -> out.append('_');
                case '=' -> {
                    // padding dropped
                }
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Decodes a base64url string, re-padding it to a multiple of four characters first.
     *
     * @param encoded the base64url text (padded or not)
     * @return the decoded bytes
     * @throws TokenDecodeException if the text contains characters outside the alphabet or
     *                              its length cannot be the result of an encoding
     */
    public static byte[] decode(String encoded) {
        if (encoded == null) {
            throw new TokenDecodeException("Cannot decode null segment", null);
        }
        if (encoded.indexOf('+') >= 0 || encoded.indexOf('/') >= 0) {
            throw new TokenDecodeException("Standard base64 characters are not valid in base64url", null);
        }
        String standard = encoded.replace('-', '+').replace('_', '/');
        int remainder = standard.length() % 4;
        if (remainder == 1) {
            throw new TokenDecodeException("Invalid base64url length: " + encoded.length(), null);
        }
        if (remainder > 0) {
            standard = standard + "=".repeat(4 - remainder);
        }
        try {
            return Base64.getDecoder().decode(standard);
        } catch (IllegalArgumentException e) {
            throw new TokenDecodeException("Invalid base64url segment", e);
        }
    }
}
