package com.tasktrack.api.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Locale;
import java.util.UUID;

/**
 * Issues and validates HMAC-signed JWT access tokens carrying the identity id as subject.
 *
 * <p>Stateless: validation only reads immutable state, so one instance serves all requests
 * concurrently. Changing the secret invalidates every token issued before.
 */
@Service
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    private final SecretKey key;
    private final MacAlgorithm algorithm;
    private final Duration ttl;
    private final Clock clock;
    private final JwtParser parser;

    public TokenService(TokenProperties properties, Clock clock) {
        this.algorithm = macAlgorithm(properties.algorithm());
        var secret = properties.secretKey().getBytes(StandardCharsets.UTF_8);
        int requiredBits = algorithm.getKeyBitLength();
        if (secret.length * 8 < requiredBits) {
            throw new IllegalStateException("security.jwt.secret-key is too short for " + algorithm.getId()
                    + ": need at least " + requiredBits / 8 + " bytes, got " + secret.length);
        }
        this.key = new SecretKeySpec(secret, "HmacSHA" + algorithm.getId().substring(2));
        this.ttl = Duration.ofMinutes(properties.accessTokenTtlMinutes());
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build();
        log.info("Access tokens signed with {}, valid for {} minutes", algorithm.getId(), ttl.toMinutes());
    }

    public String issue(UUID identityId) {
        return issue(identityId, clock.instant());
    }

    /**
     * Signs a token for {@code identityId} that expires {@code ttl} after {@code issuedAt}.
     * JWT dates have second precision, so {@code issuedAt} is truncated to the second.
     */
    public String issue(UUID identityId, Instant issuedAt) {
        var iat = issuedAt.truncatedTo(ChronoUnit.SECONDS);
        return Jwts.builder()
                .subject(identityId.toString())
                .issuedAt(Date.from(iat))
                .expiration(Date.from(iat.plus(ttl)))
                .signWith(key, algorithm)
                .compact();
    }

    /**
     * Returns the identity id the token was issued for.
     *
     * @throws InvalidTokenException signature mismatch, malformed structure, unexpected algorithm,
     *     missing expiry or a subject that is not an identity id
     * @throws ExpiredTokenException the current time is at or past the expiry
     */
    public UUID validate(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty");
        }
        Jws<Claims> jws;
        try {
            jws = parser.parseSignedClaims(token);
        } catch (ExpiredJwtException e) {
            throw new ExpiredTokenException("Token has expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Token is invalid", e);
        }
        if (!algorithm.getId().equals(jws.getHeader().getAlgorithm())) {
            throw new InvalidTokenException("Token is signed with an unexpected algorithm");
        }

        var claims = jws.getPayload();
        var expiration = claims.getExpiration();
        if (expiration == null) {
            throw new InvalidTokenException("Token has no expiry");
        }
        // valid only while now < exp
        if (!clock.instant().isBefore(expiration.toInstant())) {
            throw new ExpiredTokenException("Token has expired");
        }

        var subject = claims.getSubject();
        if (subject == null) {
            throw new InvalidTokenException("Token has no subject");
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("Token subject is not an identity id", e);
        }
    }

    public long expiresInSeconds() {
        return ttl.toSeconds();
    }

    private static MacAlgorithm macAlgorithm(String name) {
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "HS256":
                return Jwts.SIG.HS256;
            case "HS384":
                return Jwts.SIG.HS384;
            case "HS512":
                return Jwts.SIG.HS512;
            default:
                throw new IllegalStateException("Unsupported security.jwt.algorithm: " + name);
        }
    }
}
