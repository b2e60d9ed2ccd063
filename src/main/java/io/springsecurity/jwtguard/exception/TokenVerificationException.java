package io.springsecurity.jwtguard.exception;

import lombok.Getter;

/**
 * Raised by the codec when a token cannot be turned back into claims.
 */
@Getter
public class TokenVerificationException extends RuntimeException {

    public enum Reason {
        /** Not a compact JWS, bad base64url or unparsable JSON. */
        MALFORMED,
        /** Signature does not match, wrong key or unexpected algorithm. */
        SIGNATURE_INVALID,
        EXPIRED,
        NOT_YET_VALID,
        /** The payload could not be mapped onto the claims type. */
        CLAIMS_TYPE_MISMATCH,
        /** A claim requirement added through a parser customizer failed. */
        CLAIMS_INVALID
    }

    private final Reason reason;

    public TokenVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
