package com.tollgate.jwtauth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Authenticates requests carrying a JWT bearer token.
 * <p>
 * A request is addressed to this authenticator when its {@value #TOKEN_TYPE_HEADER} header
 * equals {@value #NAME}; other requests pass through untouched. The token is read from
 * {@value #AUTHORIZATION_HEADER}, with or without a {@code Bearer} prefix.
 * <p>
 * On first receipt a token is checked by the {@link TokenVerifier}, its claims are mapped to a
 * {@link UserProfile}, and the profile is cached against the token. Later requests with the same
 * token reuse the cached profile, until the optional time-to-live has elapsed since it was
 * cached; then the token is verified again and the entry overwritten.
 * <p>
 * Thread-safe. No lock is held while the verifier runs, so concurrent first requests for one
 * token may each verify it; the last one to finish wins the cache entry.
 * <p>
 * Never redirects. Reasons for failure are logged, never returned to the caller.
 */
public final class JwtAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticator.class);

    /** Name of this authenticator, expected in the token type header. */
    public static final String NAME = "JWT";

    /** Header naming the authenticator a request is addressed to. */
    public static final String TOKEN_TYPE_HEADER = "X-token-type";

    /** Header carrying the token. */
    public static final String AUTHORIZATION_HEADER = "Authorization";

    private final TokenVerifier verifier;
    private final JwtAuthenticatorOptions options;
    private final IdentityMapper identityMapper;
    private final CredentialCache cache;
    private final Clock clock;
    private final AuthenticationMetrics metrics;

    /**
     * Authenticator with default options: subject {@code sub}, profiles cached until evicted.
     */
    public JwtAuthenticator(TokenVerifier verifier) {
        this(verifier, JwtAuthenticatorOptions.defaults());
    }

    public JwtAuthenticator(TokenVerifier verifier, JwtAuthenticatorOptions options) {
        this(verifier, options, Clock.systemUTC());
    }

    private JwtAuthenticator(TokenVerifier verifier, JwtAuthenticatorOptions options, Clock clock) {
        this(verifier, options, new ConcurrentMapCredentialCache(clock), clock, AuthenticationMetrics.global(NAME));
    }

    /**
     * @param verifier the signature verifier
     * @param options  subject claim, TTL and enricher
     * @param cache    store of verified tokens; should stamp entries from the same clock
     * @param clock    time source for TTL checks
     * @param metrics  where outcomes and cache results are counted
     */
    public JwtAuthenticator(
            TokenVerifier verifier,
            JwtAuthenticatorOptions options,
            CredentialCache cache,
            Clock clock,
            AuthenticationMetrics metrics) {
        this.verifier = Objects.requireNonNull(verifier, "verifier must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.identityMapper = new IdentityMapper(options.subjectClaim(), options.profileEnricher());
    }

    public String name() {
        return NAME;
    }

    /** Always false: this authenticator never sends the client elsewhere to log in. */
    public boolean isRedirecting() {
        return false;
    }

    public JwtAuthenticatorOptions options() {
        return options;
    }

    public CredentialCache cache() {
        return cache;
    }

    /**
     * Authenticates the request and calls exactly one method of the callback, once.
     */
    public void authenticate(AuthenticationRequest request, AuthenticationCallback callback) {
        authenticate(request).deliverTo(callback);
    }

    /**
     * Authenticates the request.
     *
     * @return SUCCESS with a profile, FAILURE, or PASS when the request is not addressed to
     *         this authenticator
     */
    public AuthenticationOutcome authenticate(AuthenticationRequest request) {
        AuthenticationOutcome outcome = resolve(request);
        switch (outcome.status()) {
            case SUCCESS -> metrics.recordSuccess();
            case FAILURE -> metrics.recordFailure();
            case PASS -> metrics.recordPass();
        }
        return outcome;
    }

    private AuthenticationOutcome resolve(AuthenticationRequest request) {
        Optional<String> tokenType = request.header(TOKEN_TYPE_HEADER);
        if (tokenType.isEmpty() || !NAME.equals(tokenType.get())) {
            return AuthenticationOutcome.pass();
        }

        Optional<String> authorization = request.header(AUTHORIZATION_HEADER);
        if (authorization.isEmpty()) {
            log.debug("Missing authorization header");
            return AuthenticationOutcome.failure();
        }
        Optional<String> extracted = BearerTokenExtractor.extract(authorization.get());
        if (extracted.isEmpty()) {
            log.debug("Authorization header holds no token");
            return AuthenticationOutcome.failure();
        }
        String token = extracted.get();

        Optional<UserProfile> cached = lookupFresh(token);
        if (cached.isPresent()) {
            return AuthenticationOutcome.success(cached.get());
        }

        try {
            metrics.timeVerification(() -> verifier.verify(token));
        } catch (TokenAuthenticationException e) {
            log.info("JWT can't be verified: {}", e.getMessage());
            return AuthenticationOutcome.failure();
        } catch (RuntimeException e) {
            log.error("Token verifier failed for token {}", BearerTokenExtractor.fingerprint(token), e);
            return AuthenticationOutcome.failure();
        }

        Map<String, Object> claims;
        try {
            claims = ClaimsExtractor.extract(token);
        } catch (TokenAuthenticationException e) {
            log.error("Couldn't decode claims: {}", e.getMessage());
            return AuthenticationOutcome.failure();
        }

        UserProfile profile;
        try {
            profile = identityMapper.map(claims);
        } catch (MissingSubjectException e) {
            log.warn("Unable to create user profile: {}", e.getMessage());
            return AuthenticationOutcome.failure();
        } catch (RuntimeException e) {
            log.error("Profile enricher failed for subject claim '{}'", identityMapper.subjectClaim(), e);
            return AuthenticationOutcome.failure();
        }

        cache.store(token, profile);
        if (log.isDebugEnabled()) {
            log.debug("Verified token {} for '{}'", BearerTokenExtractor.fingerprint(token), profile.id());
        }
        return AuthenticationOutcome.success(profile);
    }

    /**
     * Returns the cached profile if the token was seen and is within its TTL. Stale entries stay
     * in the cache; they are overwritten once the token verifies again.
     */
    private Optional<UserProfile> lookupFresh(String token) {
        Optional<CachedCredential> entry = cache.lookup(token);
        if (entry.isEmpty()) {
            metrics.recordCacheMiss();
            return Optional.empty();
        }
        Duration ttl = options.tokenTimeToLive();
        if (!entry.get().isFresh(clock.instant(), ttl)) {
            metrics.recordCacheStale();
            if (log.isDebugEnabled()) {
                log.debug("Cached credential for token {} is older than {}, re-verifying",
                        BearerTokenExtractor.fingerprint(token), ttl);
            }
            return Optional.empty();
        }
        metrics.recordCacheHit();
        if (log.isTraceEnabled()) {
            log.trace("Credential cache hit for token {}", BearerTokenExtractor.fingerprint(token));
        }
        return Optional.of(entry.get().profile());
    }
}
