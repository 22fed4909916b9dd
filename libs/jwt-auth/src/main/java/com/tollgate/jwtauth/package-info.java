/**
 * JWT bearer authentication with a cache of verified credentials.
 *
 * <p>Entry point is {@link com.tollgate.jwtauth.JwtAuthenticator}. Per request it:
 *
 * <ul>
 *   <li>checks the {@code X-token-type} header and passes on requests meant for another
 *       authenticator
 *   <li>reads the token from {@code Authorization}, with or without {@code Bearer}
 *   <li>reuses a cached {@link com.tollgate.jwtauth.UserProfile} if the token was verified
 *       within the configured time-to-live
 *   <li>otherwise calls the {@link com.tollgate.jwtauth.TokenVerifier}, decodes the claims with
 *       {@link com.tollgate.jwtauth.ClaimsExtractor}, maps them with
 *       {@link com.tollgate.jwtauth.IdentityMapper} and caches the result
 * </ul>
 *
 * <p>Spring applications import {@link com.tollgate.jwtauth.JwtAuthConfiguration}, which binds
 * {@code tollgate.jwt.*} and registers the authenticator bean.
 *
 * @see com.tollgate.jwtauth.JwtAuthenticatorOptions
 * @see com.tollgate.jwtauth.CredentialCache
 */
package com.tollgate.jwtauth;
