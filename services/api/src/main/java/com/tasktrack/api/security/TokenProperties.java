package com.tasktrack.api.security;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Signing settings for access tokens, bound from {@code security.jwt.*} once at startup.
 *
 * <pre>
 * security:
 *   jwt:
 *     secret-key: ${JWT_SECRET_KEY}
 *     algorithm: HS256
 *     access-token-ttl-minutes: 30
 * </pre>
 *
 * <p>A blank secret fails Bean Validation and a TTL below one minute fails binding, so the context
 * refuses to start. Key length and the algorithm name are checked by {@link TokenService}.
 *
 * @param secretKey HMAC secret, required, no default
 * @param algorithm JWS algorithm id, one of HS256, HS384, HS512 (default HS256)
 * @param accessTokenTtlMinutes token lifetime in minutes, positive (default 30 when unset)
 */
@ConfigurationProperties(prefix = "security.jwt")
@Validated
public record TokenProperties(@NotBlank String secretKey, String algorithm, Integer accessTokenTtlMinutes) {

    public static final String DEFAULT_ALGORITHM = "HS256";
    public static final int DEFAULT_TTL_MINUTES = 30;

    public TokenProperties {
        if (algorithm == null || algorithm.isBlank()) {
            algorithm = DEFAULT_ALGORITHM;
        }
        if (accessTokenTtlMinutes == null) {
            accessTokenTtlMinutes = DEFAULT_TTL_MINUTES;
        }
        if (accessTokenTtlMinutes <= 0) {
            throw new IllegalArgumentException(
                    "security.jwt.access-token-ttl-minutes must be positive, was " + accessTokenTtlMinutes);
        }
    }
}
