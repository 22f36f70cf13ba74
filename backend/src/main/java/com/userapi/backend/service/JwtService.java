package com.userapi.backend.service;

import com.userapi.backend.entity.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

@Service
public class JwtService {

    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_ROLE = "role";

    private final SecretKey key;
    private final long expMinutes;

    public JwtService(
            @Value("${app.jwt.secret}") String secretBase64,
            @Value("${app.jwt.expiration-minutes:60}") long expMinutes
    ) {
        // HS256 needs at least 256 bits; hmacShaKeyFor rejects shorter keys
        this.key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(secretBase64));
        this.expMinutes = expMinutes;
    }

    public String generateToken(User user) {
        Instant now = Instant.now();
        Instant exp = now.plusSeconds(expMinutes * 60);
        return Jwts.builder()
                .setSubject(String.valueOf(user.getId()))
                .addClaims(Map.of(CLAIM_EMAIL, user.getEmail(), CLAIM_ROLE, user.getRole()))
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp))
                .signWith(key)
                .compact();
    }

    public long getExpirationSeconds() {
        return expMinutes * 60;
    }

    /**
     * Verifies signature and expiry.
     *
     * @throws io.jsonwebtoken.JwtException if the token is tampered, malformed or expired
     * @throws IllegalArgumentException if the token is empty
     */
    public Claims parseClaims(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build()
                .parseClaimsJws(token).getBody();
    }
}
