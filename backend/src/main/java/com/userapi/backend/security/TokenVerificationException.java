package com.userapi.backend.security;

import org.springframework.security.core.AuthenticationException;

public class TokenVerificationException extends AuthenticationException {

    public static final String MISSING = "authorization token required";
    public static final String BAD_FORMAT = "invalid authorization header format";
    public static final String INVALID = "invalid or expired token";

    public TokenVerificationException(String msg) {
        super(msg);
    }

    public TokenVerificationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
