package com.userapi.backend.dto;

public record UserSummary(
        Long id,
        String email,
        String name,
        String role
) {}
