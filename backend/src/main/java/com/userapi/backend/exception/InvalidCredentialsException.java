package com.userapi.backend.exception;

/**
 * Login failure. Unknown email, wrong password and inactive account all
 * surface with the same message.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super("invalid credentials");
    }
}
