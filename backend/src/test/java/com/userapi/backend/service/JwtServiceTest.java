package com.userapi.backend.service;

import com.userapi.backend.entity.User;
import io.jsonwebtoken.Claims;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JwtServiceTest {

    private static final String SECRET = "dXNlci1hcGktdGVzdC1zaWduaW5nLXNlY3JldC0wMTIzNDU2Nzg5YWJjZGVm";

    private final JwtService jwtService = new JwtService(SECRET, 30);

    @Test
    void tokenCarriesUserIdEmailRoleAndExpiry() {
        User user = new User();
        user.setId(42L);
        user.setEmail("a@b.com");
        user.setRole("user");

        Claims claims = jwtService.parseClaims(jwtService.generateToken(user));

        assertThat(claims.getSubject()).isEqualTo("42");
        assertThat(claims.get(JwtService.CLAIM_EMAIL, String.class)).isEqualTo("a@b.com");
        assertThat(claims.get(JwtService.CLAIM_ROLE, String.class)).isEqualTo("user");
        long lifetimeMs = claims.getExpiration().getTime() - claims.getIssuedAt().getTime();
        assertThat(lifetimeMs).isEqualTo(30 * 60 * 1000L);
        assertThat(jwtService.getExpirationSeconds()).isEqualTo(1800);
    }

    @Test
    void tokensForDifferentUsersDiffer() {
        User a = new User();
        a.setId(1L);
        a.setEmail("a@b.com");
        User b = new User();
        b.setId(2L);
        b.setEmail("c@d.com");

        assertThat(jwtService.generateToken(a)).isNotEqualTo(jwtService.generateToken(b));
    }
}
