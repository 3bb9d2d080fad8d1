package com.tasktrack.api.security;

/**
 * The token is correctly signed but the clock has reached its expiry.
 */
public class ExpiredTokenException extends TokenException {

    public ExpiredTokenException(String message) {
        super(message);
    }

    public ExpiredTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
