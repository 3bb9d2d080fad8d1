package com.tasktrack.api.errors;

/**
 * Bad credentials at login. The message never says whether the user exists.
 */
public class AuthenticationFailedException extends RuntimeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
