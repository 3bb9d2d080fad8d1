package com.tasktrack.api.errors;

/**
 * A uniqueness rule was violated, e.g. the email or username is already registered.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
