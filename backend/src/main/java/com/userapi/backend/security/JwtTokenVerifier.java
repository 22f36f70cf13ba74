package com.userapi.backend.security;

import com.userapi.backend.service.JwtService;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class JwtTokenVerifier implements TokenVerifier {

    private final JwtService jwt;

    @Override
    public AuthenticatedUser verify(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw new TokenVerificationException(TokenVerificationException.MISSING);
        }
        if (!authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new TokenVerificationException(TokenVerificationException.BAD_FORMAT);
        }

        String token = authorizationHeader.substring(BEARER_PREFIX.length());
        try {
            Claims claims = jwt.parseClaims(token);
            Long userId = Long.valueOf(claims.getSubject());
            return new AuthenticatedUser(
                    userId,
                    claims.get(JwtService.CLAIM_EMAIL, String.class),
                    claims.get(JwtService.CLAIM_ROLE, String.class)
            );
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("token rejected: {}", e.getMessage());
            throw new TokenVerificationException(TokenVerificationException.INVALID, e);
        }
    }
}
