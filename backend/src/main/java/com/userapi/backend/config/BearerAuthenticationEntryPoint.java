package com.userapi.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.userapi.backend.dto.ApiErrorResponse;
import com.userapi.backend.security.TokenVerificationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Slf4j
@Component
@RequiredArgsConstructor
public class BearerAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        String message = TokenVerificationException.MISSING;
        Object parked = request.getAttribute(JwtAuthFilter.AUTH_ERROR_ATTRIBUTE);
        if (parked instanceof TokenVerificationException e) {
            message = e.getMessage();
        }

        log.debug("rejected {} {}: {}", request.getMethod(), request.getRequestURI(), message);
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), new ApiErrorResponse(message));
    }
}
