package com.userapi.backend.dto;

public record UserUpdateResponse(String message, UserResponse user) {}
