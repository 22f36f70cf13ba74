package com.userapi.backend.security;

/**
 * Caller identity recovered from a verified bearer token.
 */
public record AuthenticatedUser(
        Long userId,
        String email,
        String role
) {}
