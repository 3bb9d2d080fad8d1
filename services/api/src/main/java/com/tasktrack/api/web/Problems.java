package com.tasktrack.api.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

import java.net.URI;
import java.time.Instant;

/**
 * Builds the RFC 7807 bodies shared by {@link GlobalExceptionHandler} and the security entry
 * point, so every rejection has one shape whichever layer produced it.
 */
public final class Problems {

    private static final String TYPE_BASE = "https://tasktrack.dev/errors/";

    private Problems() {}

    public static ProblemDetail of(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
