package com.example.schoolidentity.security;

import com.example.schoolidentity.dto.ErrorResponse;
import com.example.schoolidentity.exception.AuthFailureReason;
import com.example.schoolidentity.exception.AuthenticationFailedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 401 for protected routes reached without an accepted credential.
 * The body is the same for every failure reason.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {

        Object attribute = request.getAttribute(JwtAuthenticationFilter.FAILURE_REASON_ATTRIBUTE);
        AuthFailureReason reason = attribute instanceof AuthFailureReason r ? r : AuthFailureReason.MISSING_CREDENTIAL;
        log.debug("Unauthenticated request to {}: {}", request.getRequestURI(), reason);

        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);

        objectMapper.writeValue(response.getOutputStream(),
                ErrorResponse.of("UNAUTHORIZED", AuthenticationFailedException.GENERIC_MESSAGE));
    }
}
