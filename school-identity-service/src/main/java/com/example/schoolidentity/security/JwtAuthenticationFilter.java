package com.example.schoolidentity.security;

import com.example.schoolidentity.exception.AuthenticationFailedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Request guard.
 *
 * Flow:
 * HTTP Request → JwtAuthenticationFilter (verify + resolve) → SecurityContextHolder → Controller
 *
 * Requests without a bearer header pass through anonymously; protected routes are then
 * rejected by {@link JwtAuthenticationEntryPoint}. A rejected credential is recorded as a
 * request attribute so the entry point can log the reason.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String FAILURE_REASON_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".FAILURE_REASON";

    private static final String BEARER_PREFIX = "Bearer ";

    private final PrincipalAuthenticator principalAuthenticator;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();

        try {
            ResolvedPrincipal principal = principalAuthenticator.authenticate(token).principal();

            UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                    principal,
                    null,
                    List.of(new SimpleGrantedAuthority(principal.role().authority()))
            );
            authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authToken);

        } catch (AuthenticationFailedException e) {
            log.warn("Rejected bearer credential on {} {}: {}",
                    request.getMethod(), request.getRequestURI(), e.getReason().description());
            request.setAttribute(FAILURE_REASON_ATTRIBUTE, e.getReason());
            SecurityContextHolder.clearContext();
        }

        filterChain.doFilter(request, response);
    }
}
