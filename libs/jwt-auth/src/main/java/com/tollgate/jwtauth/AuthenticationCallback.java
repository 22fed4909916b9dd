package com.tollgate.jwtauth;

import java.util.Map;

/**
 * Receives the outcome of one authentication attempt. Exactly one method is called, once.
 * <p>
 * The status hint and detail map are null from {@link JwtAuthenticator}: the reason for a
 * failure is logged for operators, not reported to the caller.
 */
public interface AuthenticationCallback {

    /** The request carried a valid token for this authenticator. */
    void onSuccess(UserProfile profile);

    /** The request was addressed to this authenticator but could not be authenticated. */
    void onFailure(Integer statusHint, Map<String, String> details);

    /** The request was not addressed to this authenticator; another one may handle it. */
    void onPass(Integer statusHint, Map<String, String> details);
}
