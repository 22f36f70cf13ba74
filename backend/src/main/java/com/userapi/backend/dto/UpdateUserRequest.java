package com.userapi.backend.dto;

import com.userapi.backend.entity.User;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update. Null or blank fields leave the stored value untouched.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateUserRequest {

    @Size(max = 128, message = "name must be at most 128 characters")
    private String name;

    @Email(message = "email must be a valid email address")
    @Size(max = User.EMAIL_MAX_LENGTH, message = "email must be at most 256 characters")
    private String email;
}
