package com.callintake.config;

import com.callintake.dto.ErrorResponse;
import com.callintake.exception.WebhookAuthenticationException;
import com.callintake.service.WebhookSecretVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Checks the shared secret on the webhook and booking paths ahead of the dispatcher,
 * so a rejected request gets 403 before content negotiation or body parsing.
 */
@Component
@RequiredArgsConstructor
public class WebhookSecretFilter extends OncePerRequestFilter {

    static final String BOOKING_PATH = "/booking";

    private final WebhookProperties properties;
    private final WebhookSecretVerifier verifier;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !path.equals(properties.safePath()) && !path.equals(BOOKING_PATH);
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        try {
            verifier.verify(
                    request.getHeader(properties.safeHeaderName()),
                    request.getParameter(properties.safeQueryParam()));
        } catch (WebhookAuthenticationException e) {
            response.setStatus(HttpStatus.FORBIDDEN.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            objectMapper.writeValue(response.getOutputStream(), ErrorResponse.of(e.getMessage()));
            return;
        }
        filterChain.doFilter(request, response);
    }
}
