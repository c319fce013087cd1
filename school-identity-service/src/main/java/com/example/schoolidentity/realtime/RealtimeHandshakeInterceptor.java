package com.example.schoolidentity.realtime;

import com.example.schoolidentity.exception.AuthenticationFailedException;
import com.example.schoolidentity.security.PrincipalAuthenticator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Handshake guard for /ws.
 *
 * Browsers cannot set headers on a WebSocket upgrade, so the credential is read from
 * the "token" query parameter first and the Authorization header second. Authentication
 * is the same as for HTTP requests. A rejected upgrade gets 401 and no session is created.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RealtimeHandshakeInterceptor implements HandshakeInterceptor {

    static final String TOKEN_PARAMETER = "token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final PrincipalAuthenticator principalAuthenticator;

    @Override
    public boolean beforeHandshake(@NonNull ServerHttpRequest request,
                                   @NonNull ServerHttpResponse response,
                                   @NonNull WebSocketHandler wsHandler,
                                   @NonNull Map<String, Object> attributes) {
        String token = extractToken(request);
        try {
            PrincipalAuthenticator.Authenticated result = principalAuthenticator.authenticate(token);
            RealtimeIdentity identity = RealtimeIdentity.of(result.claims(), result.principal());
            attributes.put(RealtimeIdentity.SESSION_ATTRIBUTE, identity);
            log.debug("Handshake accepted for {} {}", identity.role(), identity.principalId());
            return true;
        } catch (AuthenticationFailedException e) {
            log.warn("Handshake rejected from {}: {}", request.getRemoteAddress(), e.getReason().description());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterHandshake(@NonNull ServerHttpRequest request,
                               @NonNull ServerHttpResponse response,
                               @NonNull WebSocketHandler wsHandler,
                               Exception exception) {
        if (exception != null) {
            log.warn("Handshake failed after authentication: {}", exception.getMessage());
        }
    }

    static String extractToken(ServerHttpRequest request) {
        String fromQuery = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams()
                .getFirst(TOKEN_PARAMETER);
        if (fromQuery != null && !fromQuery.isBlank()) {
            return fromQuery;
        }
        String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            return header.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }
}
