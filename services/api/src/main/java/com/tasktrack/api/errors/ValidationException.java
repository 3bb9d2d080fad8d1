package com.tasktrack.api.errors;

/**
 * Input that is well-formed JSON but violates a domain rule, e.g. a blank todo title.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
