package com.tasktrack.api.security;

import com.tasktrack.api.errors.UnauthenticatedException;
import com.tasktrack.api.users.CredentialStore;
import com.tasktrack.api.users.Identity;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Turns a raw {@code Authorization} header into the identity making the request. Every protected
 * operation goes through {@link #resolve(String)}; see {@link JwtAuthFilter}.
 */
@Component
public class IdentityResolver {

    private final TokenService tokens;
    private final CredentialStore credentials;

    public IdentityResolver(TokenService tokens, CredentialStore credentials) {
        this.tokens = tokens;
        this.credentials = credentials;
    }

    /**
     * @throws UnauthenticatedException the header is absent or not a bearer credential, the token
     *     is invalid or expired, or its identity no longer exists
     */
    public Identity resolve(String authorizationHeader) {
        var token = BearerTokenExtractor.extract(authorizationHeader)
                .orElseThrow(() -> new UnauthenticatedException("Missing bearer token"));

        UUID identityId;
        try {
            identityId = tokens.validate(token);
        } catch (ExpiredTokenException e) {
            throw new UnauthenticatedException("Token has expired", e);
        } catch (TokenException e) {
            throw new UnauthenticatedException("Could not validate credentials", e);
        }

        return credentials.findById(identityId)
                .orElseThrow(() -> new UnauthenticatedException("Could not validate credentials"));
    }
}
