package tech.yump.amethyst.auth;

import lombok.Getter;

/**
 * Rejected credentials or a disallowed caller. Messages never reveal whether a bucket exists.
 */
@Getter
public class AuthException extends RuntimeException {

    public enum Reason {
        INVALID_TOKEN,
        EXPIRED_TOKEN,
        CLIENT_MISMATCH,
        SCOPE_MISMATCH,
        IP_NOT_ALLOWED
    }

    private final Reason reason;

    public AuthException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static AuthException invalidToken(Throwable cause) {
        return new AuthException(Reason.INVALID_TOKEN, "Token is invalid.", cause);
    }

    public static AuthException expiredToken(Throwable cause) {
        return new AuthException(Reason.EXPIRED_TOKEN, "Token has expired.", cause);
    }

    public static AuthException clientMismatch() {
        return new AuthException(Reason.CLIENT_MISMATCH, "Client credentials are not valid for the requested bucket.");
    }

    public static AuthException scopeMismatch() {
        return new AuthException(Reason.SCOPE_MISMATCH, "Token is not valid for the requested bucket.");
    }

    public static AuthException ipNotAllowed(String clientAddress) {
        return new AuthException(Reason.IP_NOT_ALLOWED, "Access from address " + clientAddress + " is not allowed.");
    }
}
