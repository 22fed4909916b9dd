package com.tollgate.jwtauth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The identity produced by a successful authentication.
 * <p>
 * Immutable once built: cached profiles are shared between concurrent requests that present
 * the same token. Extension attributes are added through {@link Builder} before the profile
 * is built, typically by a {@link UserProfileEnricher}.
 *
 * @param id          the bearer's identity (value of the subject claim)
 * @param displayName human-readable name, defaults to {@code id}
 * @param provider    tag of the authentication method that produced this profile
 * @param attributes  extension attributes, never null
 */
public record UserProfile(
        String id,
        String displayName,
        String provider,
        Map<String, Object> attributes
) {

    public UserProfile {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        if (displayName == null) {
            displayName = id;
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public UserProfile(String id, String displayName, String provider) {
        this(id, displayName, provider, Map.of());
    }

    /** Returns the extension attribute with the given name, if present. */
    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /**
     * Returns the extension attribute with the given name if present and of the given type.
     */
    public <T> Optional<T> attribute(String name, Class<T> type) {
        return attribute(name).filter(type::isInstance).map(type::cast);
    }

    /** Starts a profile whose display name equals its id. */
    public static Builder builder(String id, String provider) {
        return new Builder(id, provider);
    }

    /**
     * Collects extension attributes for a profile under construction. The identity fields are
     * read-only here.
     */
    public static final class Builder {

        private final String id;
        private final String provider;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(String id, String provider) {
            this.id = Objects.requireNonNull(id, "id must not be null");
            this.provider = Objects.requireNonNull(provider, "provider must not be null");
        }

        public String id() {
            return id;
        }

        public String displayName() {
            return id;
        }

        public String provider() {
            return provider;
        }

        /**
         * Adds or replaces an extension attribute.
         *
         * @throws NullPointerException if name or value is null
         */
        public Builder attribute(String name, Object value) {
            attributes.put(
                    Objects.requireNonNull(name, "attribute name must not be null"),
                    Objects.requireNonNull(value, "attribute value must not be null"));
            return this;
        }

        /** Returns a read-only view of the attributes added so far. */
        public Map<String, Object> attributes() {
            return Collections.unmodifiableMap(attributes);
        }

        public UserProfile build() {
            return new UserProfile(id, id, provider, attributes);
        }
    }
}
