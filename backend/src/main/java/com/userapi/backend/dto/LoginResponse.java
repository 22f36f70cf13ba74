package com.userapi.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class LoginResponse {
    private String message;
    private String token;
    private String tokenType;
    private long expiresIn; // seconds
    private UserSummary user;
}
