package com.tollgate.jwtauth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JwtAuthenticatorOptions")
class JwtAuthenticatorOptionsTest {

    @Nested
    @DisplayName("defaults")
    class Defaults {

        @Test
        @DisplayName("subject 'sub', no TTL, no enricher")
        void defaults() {
            var options = JwtAuthenticatorOptions.defaults();
            assertThat(options.subjectClaim()).isEqualTo("sub");
            assertThat(options.tokenTimeToLive()).isNull();
            assertThat(options.timeToLive()).isEmpty();
            assertThat(options.profileEnricher()).isNull();
        }

        @Test
        @DisplayName("defaults a blank subject claim to 'sub'")
        void blankSubject() {
            assertThat(new JwtAuthenticatorOptions("  ", null, null).subjectClaim()).isEqualTo("sub");
        }

        @Test
        @DisplayName("rejects zero or negative TTL")
        void nonPositiveTtl() {
            assertThatThrownBy(() -> JwtAuthenticatorOptions.defaults().withTokenTimeToLive(Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("tokenTimeToLive");
            assertThatThrownBy(() -> JwtAuthenticatorOptions.defaults().withTokenTimeToLive(Duration.ofSeconds(-1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("with-methods return modified copies")
        void withMethods() {
            UserProfileEnricher enricher = (profile, claims) -> { };
            var options = JwtAuthenticatorOptions.defaults()
                    .withSubjectClaim("email")
                    .withTokenTimeToLive(Duration.ofMinutes(5))
                    .withProfileEnricher(enricher);

            assertThat(options.subjectClaim()).isEqualTo("email");
            assertThat(options.timeToLive()).contains(Duration.ofMinutes(5));
            assertThat(options.profileEnricher()).isSameAs(enricher);
            assertThat(JwtAuthenticatorOptions.defaults().subjectClaim()).isEqualTo("sub");
        }
    }
}
