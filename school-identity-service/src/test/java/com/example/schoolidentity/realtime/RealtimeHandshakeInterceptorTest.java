package com.example.schoolidentity.realtime;

import com.example.schoolidentity.entity.PrincipalKind;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.exception.AuthFailureReason;
import com.example.schoolidentity.exception.AuthenticationFailedException;
import com.example.schoolidentity.security.CredentialClaims;
import com.example.schoolidentity.security.PrincipalAuthenticator;
import com.example.schoolidentity.security.ResolvedPrincipal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RealtimeHandshakeInterceptorTest {

    @Mock
    private PrincipalAuthenticator principalAuthenticator;

    @InjectMocks
    private RealtimeHandshakeInterceptor interceptor;

    private final WebSocketHandler handler = mock(WebSocketHandler.class);

    private static MockHttpServletRequest upgrade(String query) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws");
        request.setQueryString(query);
        return request;
    }

    @Test
    void tokenQueryParameterIsPreferred() {
        MockHttpServletRequest request = upgrade("token=from-query");
        request.addHeader("Authorization", "Bearer from-header");

        assertEquals("from-query", RealtimeHandshakeInterceptor.extractToken(new ServletServerHttpRequest(request)));
    }

    @Test
    void authorizationHeaderIsTheFallback() {
        MockHttpServletRequest request = upgrade(null);
        request.addHeader("Authorization", "Bearer from-header");

        assertEquals("from-header", RealtimeHandshakeInterceptor.extractToken(new ServletServerHttpRequest(request)));
    }

    @Test
    void acceptedHandshakeBindsIdentityToSession() {
        CredentialClaims claims = new CredentialClaims("s-1", "student", "school-1", null,
                Instant.EPOCH, Instant.EPOCH.plusSeconds(3600));
        ResolvedPrincipal principal = new ResolvedPrincipal("s-1", PrincipalKind.STUDENT, Role.STUDENT,
                "school-1", "s@school.test", "S", true, false, List.of(), "class-3");
        when(principalAuthenticator.authenticate("good"))
                .thenReturn(new PrincipalAuthenticator.Authenticated(claims, principal));
        Map<String, Object> attributes = new HashMap<>();

        boolean accepted = interceptor.beforeHandshake(new ServletServerHttpRequest(upgrade("token=good")),
                new ServletServerHttpResponse(new MockHttpServletResponse()), handler, attributes);

        assertTrue(accepted);
        RealtimeIdentity identity = (RealtimeIdentity) attributes.get(RealtimeIdentity.SESSION_ATTRIBUTE);
        assertEquals("s-1", identity.principalId());
        assertEquals(Role.STUDENT, identity.role());
        assertEquals("school-1", identity.tenantId());
        assertEquals("class-3", identity.classId());
    }

    @Test
    void rejectedHandshakeAnswers401AndBindsNothing() throws Exception {
        when(principalAuthenticator.authenticate("bad"))
                .thenThrow(new AuthenticationFailedException(AuthFailureReason.EXPIRED_CREDENTIAL));
        MockHttpServletResponse servletResponse = new MockHttpServletResponse();
        ServletServerHttpResponse response = new ServletServerHttpResponse(servletResponse);
        Map<String, Object> attributes = new HashMap<>();

        boolean accepted = interceptor.beforeHandshake(new ServletServerHttpRequest(upgrade("token=bad")),
                response, handler, attributes);
        response.flush();

        assertFalse(accepted);
        assertEquals(401, servletResponse.getStatus());
        assertTrue(attributes.isEmpty());
    }
}
