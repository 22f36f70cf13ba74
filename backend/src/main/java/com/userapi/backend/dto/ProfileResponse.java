package com.userapi.backend.dto;

public record ProfileResponse(String message, UserSummary profile) {}
