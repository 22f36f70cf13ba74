package com.userapi.backend.dto;

import com.userapi.backend.entity.User;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "email is required")
    @Email(message = "email must be a valid email address")
    @Size(max = User.EMAIL_MAX_LENGTH, message = "email must be at most 256 characters")
    private String email;

    @ToString.Exclude
    @NotBlank(message = "password is required")
    private String password;
}
