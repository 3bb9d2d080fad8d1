package com.tasktrack.api.errors;

/**
 * A protected call arrived without a usable bearer token: missing, malformed, invalid, expired,
 * or naming an identity that no longer exists.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
