package com.userapi.backend.security;

/**
 * Turns the raw {@code Authorization} header value into a caller identity.
 *
 * <p>Implementations throw {@link TokenVerificationException} when the header is
 * missing, malformed, or carries a token that does not verify.
 */
public interface TokenVerifier {

    String BEARER_PREFIX = "Bearer ";

    AuthenticatedUser verify(String authorizationHeader) throws TokenVerificationException;
}
