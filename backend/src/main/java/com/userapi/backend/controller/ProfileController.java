package com.userapi.backend.controller;

import com.userapi.backend.dto.ProfileResponse;
import com.userapi.backend.security.AuthenticatedUser;
import com.userapi.backend.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/profile")
@RequiredArgsConstructor
public class ProfileController {

    private final UserService userService;

    @GetMapping
    public ProfileResponse profile(@AuthenticationPrincipal AuthenticatedUser caller) {
        return new ProfileResponse("user profile", userService.getProfile(caller));
    }
}
