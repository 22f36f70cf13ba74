package com.userapi.backend.dto;

public record MessageResponse(String message) {}
