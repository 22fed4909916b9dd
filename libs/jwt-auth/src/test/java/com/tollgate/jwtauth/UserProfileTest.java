package com.tollgate.jwtauth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UserProfile")
class UserProfileTest {

    @Test
    @DisplayName("defaults display name to id")
    void defaultsDisplayName() {
        var profile = new UserProfile("alice", null, "JWT");
        assertThat(profile.displayName()).isEqualTo("alice");
    }

    @Test
    @DisplayName("requires id and provider")
    void requiresIdentity() {
        assertThatThrownBy(() -> new UserProfile(null, "x", "JWT")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new UserProfile("alice", "x", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("copies attributes so later changes to the source do not leak in")
    void attributesCopied() {
        Map<String, Object> source = new HashMap<>();
        source.put("email", "alice@example.com");
        var profile = new UserProfile("alice", "Alice", "JWT", source);

        source.put("email", "mallory@example.com");

        assertThat(profile.attribute("email")).contains("alice@example.com");
        assertThatThrownBy(() -> profile.attributes().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("typed attribute lookup filters by type")
    void typedLookup() {
        var profile = UserProfile.builder("alice", "JWT").attribute("age", 30).build();

        assertThat(profile.attribute("age", Integer.class)).contains(30);
        assertThat(profile.attribute("age", String.class)).isEmpty();
        assertThat(profile.attribute("missing", String.class)).isEmpty();
    }

    @Test
    @DisplayName("builder rejects null attribute values")
    void builderRejectsNull() {
        var builder = UserProfile.builder("alice", "JWT");
        assertThatThrownBy(() -> builder.attribute("email", null)).isInstanceOf(NullPointerException.class);
    }
}
