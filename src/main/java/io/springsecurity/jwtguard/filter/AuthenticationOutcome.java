package io.springsecurity.jwtguard.filter;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Result of authenticating a single request.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class AuthenticationOutcome<C> {

    public enum Status {
        /** The request is exempt, nothing was extracted or verified. */
        EXEMPT,
        /** The response has been set to 401, the request must not be processed further. */
        REJECTED,
        AUTHENTICATED
    }

    private static final AuthenticationOutcome<?> EXEMPT = new AuthenticationOutcome<>(Status.EXEMPT, null);
    private static final AuthenticationOutcome<?> REJECTED = new AuthenticationOutcome<>(Status.REJECTED, null);

    private final Status status;
    private final C claims;

    @SuppressWarnings("unchecked")
    public static <C> AuthenticationOutcome<C> exempt() {
        return (AuthenticationOutcome<C>) EXEMPT;
    }

    @SuppressWarnings("unchecked")
    public static <C> AuthenticationOutcome<C> rejected() {
        return (AuthenticationOutcome<C>) REJECTED;
    }

    public static <C> AuthenticationOutcome<C> authenticated(C claims) {
        return new AuthenticationOutcome<>(Status.AUTHENTICATED, claims);
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }

    public boolean isAuthenticated() {
        return status == Status.AUTHENTICATED;
    }

    public Optional<C> claims() {
        return Optional.ofNullable(claims);
    }
}
