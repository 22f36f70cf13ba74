package com.userapi.backend.exception;

public class UserNotFoundException extends RuntimeException {

    private final Long userId;

    public UserNotFoundException(Long userId) {
        super("user not found");
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }
}
