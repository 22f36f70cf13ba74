package com.userapi.backend.exception;

public class EmailAlreadyRegisteredException extends RuntimeException {

    public EmailAlreadyRegisteredException() {
        super("email already registered");
    }

    public EmailAlreadyRegisteredException(Throwable cause) {
        super("email already registered", cause);
    }
}
