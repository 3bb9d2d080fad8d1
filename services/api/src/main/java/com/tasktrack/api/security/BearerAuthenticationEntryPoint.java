package com.tasktrack.api.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasktrack.api.web.Problems;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Answers protected requests that reached authorization without a resolved identity.
 */
@Component
class BearerAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    BearerAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest req, HttpServletResponse res, AuthenticationException ex)
            throws IOException {
        Object reason = req.getAttribute(JwtAuthFilter.FAILURE_ATTRIBUTE);
        var detail = reason != null ? reason.toString() : "Not authenticated";

        res.setStatus(HttpStatus.UNAUTHORIZED.value());
        res.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        res.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(res.getOutputStream(),
                Problems.of(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthenticated", detail));
    }
}
