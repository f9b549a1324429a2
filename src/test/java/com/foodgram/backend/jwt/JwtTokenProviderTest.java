package com.foodgram.backend.jwt;

import com.foodgram.backend.domain.entity.User;
import com.foodgram.backend.domain.type.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenProviderTest {

    private static final String SECRET = "unit-test-secret-key-with-at-least-32-bytes!!";

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET, 60_000L);

    @Test
    void tokenCarriesUserIdAndVersion() {
        User user = User.builder().id(42L).role(Role.ADMIN).tokenVersion(3).build();

        Claims claims = provider.parseClaims(provider.createAccessToken(user));

        assertThat(provider.getUserId(claims)).isEqualTo(42L);
        assertThat(provider.getTokenVersion(claims)).isEqualTo(3);
        assertThat(claims.get(JwtTokenProvider.ROLE_CLAIM, String.class)).isEqualTo("ADMIN");
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenProvider other = new JwtTokenProvider("another-secret-key-that-is-long-enough-too", 60_000L);
        String foreign = other.createAccessToken(User.builder().id(1L).build());

        assertThatThrownBy(() -> provider.parseClaims(foreign)).isInstanceOf(JwtException.class);
    }

    @Test
    void expiredTokenIsRejected() {
        JwtTokenProvider shortLived = new JwtTokenProvider(SECRET, -1_000L);
        String expired = shortLived.createAccessToken(User.builder().id(1L).build());

        assertThatThrownBy(() -> provider.parseClaims(expired))
                .isInstanceOf(JwtException.class)
                .hasMessage("Token has expired.");
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> provider.parseClaims("not-a-token")).isInstanceOf(JwtException.class);
    }
}
