package com.tasktrack.api.errors;

/**
 * The record does not exist or is owned by someone else. Callers cannot tell the two apart.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
