package com.tasktrack.api.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tasktrack.api.errors.UnauthenticatedException;
import com.tasktrack.api.users.Identity;
import com.tasktrack.api.users.testing.InMemoryCredentialStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IdentityResolver")
class IdentityResolverTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final TokenProperties PROPS =
            new TokenProperties("resolver-test-secret-0123456789abcdef", "HS256", 30);

    private final InMemoryCredentialStore credentials = new InMemoryCredentialStore();
    private final TokenService tokens = new TokenService(PROPS, Clock.fixed(NOW, ZoneOffset.UTC));
    private final IdentityResolver resolver = new IdentityResolver(tokens, credentials);

    private Identity alice;

    @BeforeEach
    void setUp() {
        alice = credentials.create("a@x.com", "alice", "hash");
    }

    @Test
    @DisplayName("resolves a valid bearer token to its identity")
    void resolvesIdentity() {
        String header = "Bearer " + tokens.issue(alice.id());

        assertThat(resolver.resolve(header)).isEqualTo(alice);
    }

    @Test
    @DisplayName("rejects a missing header")
    void missingHeader() {
        assertThatThrownBy(() -> resolver.resolve(null))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessage("Missing bearer token");
    }

    @Test
    @DisplayName("rejects a non-bearer credential without consulting the token service")
    void wrongScheme() {
        assertThatThrownBy(() -> resolver.resolve("Basic YWxpY2U6cHcxMjM="))
                .isInstanceOf(UnauthenticatedException.class)
                .hasNoCause();
    }

    @Test
    @DisplayName("wraps an invalid token, keeping the cause")
    void invalidToken() {
        assertThatThrownBy(() -> resolver.resolve("Bearer not-a-token"))
                .isInstanceOf(UnauthenticatedException.class)
                .hasCauseInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("wraps an expired token, keeping the cause")
    void expiredToken() {
        String stale = tokens.issue(alice.id(), NOW.minus(Duration.ofHours(1)));

        assertThatThrownBy(() -> resolver.resolve("Bearer " + stale))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessage("Token has expired")
                .hasCauseInstanceOf(ExpiredTokenException.class);
    }

    @Test
    @DisplayName("rejects a valid token whose identity no longer exists")
    void deletedIdentity() {
        String header = "Bearer " + tokens.issue(alice.id());
        credentials.remove(alice.id());

        assertThatThrownBy(() -> resolver.resolve(header)).isInstanceOf(UnauthenticatedException.class);
    }

    @Test
    @DisplayName("rejects a valid token for an identity that was never registered")
    void unknownIdentity() {
        String header = "Bearer " + tokens.issue(UUID.randomUUID());

        assertThatThrownBy(() -> resolver.resolve(header)).isInstanceOf(UnauthenticatedException.class);
    }
}
