package com.userapi.backend.dto;

public record RegisterResponse(String message, UserSummary user) {}
