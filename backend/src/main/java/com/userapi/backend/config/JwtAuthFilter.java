package com.userapi.backend.config;

import com.userapi.backend.security.AuthenticatedUser;
import com.userapi.backend.security.TokenVerificationException;
import com.userapi.backend.security.TokenVerifier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Resolves the caller from the bearer header. Never rejects by itself: a failed
 * verification is parked on the request and reported by
 * {@link BearerAuthenticationEntryPoint} if the route turns out to be protected.
 */
@Component
@RequiredArgsConstructor
public class JwtAuthFilter extends OncePerRequestFilter {

    public static final String AUTH_ERROR_ATTRIBUTE = JwtAuthFilter.class.getName() + ".AUTH_ERROR";

    private final TokenVerifier verifier;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String auth = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth != null && !auth.isBlank()) {
            try {
                AuthenticatedUser user = verifier.verify(auth);
                String role = user.role() == null ? "USER" : user.role().toUpperCase(Locale.ROOT);

                var authToken = new UsernamePasswordAuthenticationToken(
                        user, null, List.of(new SimpleGrantedAuthority("ROLE_" + role))
                );
                SecurityContextHolder.getContext().setAuthentication(authToken);
                MDC.put(RequestLoggingFilter.MDC_USER_ID, String.valueOf(user.userId()));
            } catch (TokenVerificationException e) {
                req.setAttribute(AUTH_ERROR_ATTRIBUTE, e);
            }
        }
        chain.doFilter(req, res);
    }
}
