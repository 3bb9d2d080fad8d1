package com.tasktrack.api.security;

import com.tasktrack.api.errors.UnauthenticatedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Resolves the caller on every protected request and places the {@code Identity} in the
 * request's security context. A failed resolution leaves the context empty and records why, so
 * {@link BearerAuthenticationEntryPoint} can explain the 401.
 */
@Component
class JwtAuthFilter extends OncePerRequestFilter {

    static final String FAILURE_ATTRIBUTE = JwtAuthFilter.class.getName() + ".failure";

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);
    private static final List<GrantedAuthority> AUTHORITIES = List.of(new SimpleGrantedAuthority("USER"));

    private final IdentityResolver identityResolver;

    JwtAuthFilter(IdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        return SecurityConfig.PUBLIC_ENDPOINTS.matches(req);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            try {
                var identity = identityResolver.resolve(req.getHeader(HttpHeaders.AUTHORIZATION));
                var authToken = new UsernamePasswordAuthenticationToken(identity, null, AUTHORITIES);
                authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
                SecurityContextHolder.getContext().setAuthentication(authToken);
            } catch (UnauthenticatedException e) {
                log.debug("Rejected credential for {} {}: {}", req.getMethod(), req.getRequestURI(), e.getMessage());
                req.setAttribute(FAILURE_ATTRIBUTE, e.getMessage());
            }
        }

        chain.doFilter(req, res);
    }
}
