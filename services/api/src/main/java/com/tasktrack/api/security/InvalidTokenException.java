package com.tasktrack.api.security;

/**
 * Malformed token, bad signature, unexpected algorithm or unusable subject.
 */
public class InvalidTokenException extends TokenException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
