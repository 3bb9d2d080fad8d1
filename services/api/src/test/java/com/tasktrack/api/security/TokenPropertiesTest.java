package com.tasktrack.api.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TokenProperties")
class TokenPropertiesTest {

    @Test
    @DisplayName("keeps explicit values")
    void keepsExplicitValues() {
        var props = new TokenProperties("secret", "HS512", 15);
        assertThat(props.secretKey()).isEqualTo("secret");
        assertThat(props.algorithm()).isEqualTo("HS512");
        assertThat(props.accessTokenTtlMinutes()).isEqualTo(15);
    }

    @Test
    @DisplayName("defaults algorithm to HS256 when missing")
    void defaultsAlgorithm() {
        assertThat(new TokenProperties("secret", null, 15).algorithm()).isEqualTo("HS256");
        assertThat(new TokenProperties("secret", " ", 15).algorithm()).isEqualTo("HS256");
    }

    @Test
    @DisplayName("defaults TTL to 30 minutes when unset")
    void defaultsTtl() {
        assertThat(new TokenProperties("secret", "HS256", null).accessTokenTtlMinutes()).isEqualTo(30);
    }

    @Test
    @DisplayName("refuses a zero or negative TTL")
    void rejectsNonPositiveTtl() {
        assertThatThrownBy(() -> new TokenProperties("secret", "HS256", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("access-token-ttl-minutes");
        assertThatThrownBy(() -> new TokenProperties("secret", "HS256", -5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
