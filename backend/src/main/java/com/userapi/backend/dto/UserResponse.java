package com.userapi.backend.dto;

import java.time.Instant;

public record UserResponse(
        Long id,
        String email,
        String name,
        String role,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {}
