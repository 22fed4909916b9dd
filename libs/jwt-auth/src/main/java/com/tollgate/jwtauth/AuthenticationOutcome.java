package com.tollgate.jwtauth;

import java.util.Objects;
import java.util.Optional;

/**
 * Value form of an {@link AuthenticationCallback} result.
 *
 * @param status  which callback fired
 * @param profile the authenticated profile, null unless {@code status} is SUCCESS
 */
public record AuthenticationOutcome(Status status, UserProfile profile) {

    public AuthenticationOutcome {
        Objects.requireNonNull(status, "status must not be null");
        if ((status == Status.SUCCESS) != (profile != null)) {
            throw new IllegalArgumentException("profile must be present exactly when status is SUCCESS");
        }
    }

    public enum Status {
        SUCCESS,
        FAILURE,
        PASS
    }

    public static AuthenticationOutcome success(UserProfile profile) {
        return new AuthenticationOutcome(Status.SUCCESS, profile);
    }

    public static AuthenticationOutcome failure() {
        return new AuthenticationOutcome(Status.FAILURE, null);
    }

    public static AuthenticationOutcome pass() {
        return new AuthenticationOutcome(Status.PASS, null);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Optional<UserProfile> userProfile() {
        return Optional.ofNullable(profile);
    }

    /** Invokes the callback method matching this outcome. */
    public void deliverTo(AuthenticationCallback callback) {
        switch (status) {
            case SUCCESS -> callback.onSuccess(profile);
            case FAILURE -> callback.onFailure(null, null);
            case PASS -> callback.onPass(null, null);
        }
    }
}
