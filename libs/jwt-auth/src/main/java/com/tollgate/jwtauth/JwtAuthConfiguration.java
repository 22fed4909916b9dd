package com.tollgate.jwtauth;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring wiring for the JWT authenticator.
 * <p>
 * The application supplies the {@link TokenVerifier} bean, and optionally a
 * {@link UserProfileEnricher} and a {@link MeterRegistry}. Without a registry, meters go to
 * {@link Metrics#globalRegistry}.
 * <p>
 * Switched off with {@code tollgate.jwt.enabled=false}.
 */
@Configuration
@EnableConfigurationProperties(JwtAuthProperties.class)
@ConditionalOnProperty(prefix = "tollgate.jwt", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JwtAuthConfiguration {

    public static final String AUTHENTICATOR_BEAN = "jwtAuthenticator";

    // cache stamps and TTL checks must read the same clock
    private final Clock clock = Clock.systemUTC();

    @Bean
    public CredentialCache jwtCredentialCache(JwtAuthProperties properties) {
        return new CaffeineCredentialCache(properties.cacheMaximumSize(), clock);
    }

    @Bean
    public AuthenticationMetrics jwtAuthenticationMetrics(ObjectProvider<MeterRegistry> registry) {
        return new AuthenticationMetrics(registry.getIfAvailable(() -> Metrics.globalRegistry), JwtAuthenticator.NAME);
    }

    @Bean(name = AUTHENTICATOR_BEAN)
    public JwtAuthenticator jwtAuthenticator(
            TokenVerifier verifier,
            JwtAuthProperties properties,
            CredentialCache jwtCredentialCache,
            AuthenticationMetrics jwtAuthenticationMetrics,
            ObjectProvider<UserProfileEnricher> profileEnricher) {
        return new JwtAuthenticator(
                verifier,
                properties.toOptions(profileEnricher.getIfAvailable()),
                jwtCredentialCache,
                clock,
                jwtAuthenticationMetrics);
    }
}
