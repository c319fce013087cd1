package com.example.schoolidentity.realtime;

import com.example.schoolidentity.entity.PrincipalKind;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.exception.AuthFailureReason;
import com.example.schoolidentity.exception.AuthenticationFailedException;
import com.example.schoolidentity.security.CredentialClaims;
import com.example.schoolidentity.security.PrincipalAuthenticator;
import com.example.schoolidentity.service.AuditService;
import com.example.schoolidentity.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.WebSocketSession;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StaleSessionSweeperTest {

    private static final Instant NOW = Instant.parse("2024-09-01T08:00:00Z");

    @Mock
    private ConnectionRegistry connectionRegistry;
    @Mock
    private PrincipalAuthenticator principalAuthenticator;
    @Mock
    private AuditService auditService;

    private MutableClock clock;
    private StaleSessionSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        sweeper = new StaleSessionSweeper(connectionRegistry, principalAuthenticator, auditService, clock);
    }

    private static WebSocketSession session(String id, RealtimeIdentity identity) {
        WebSocketSession session = mock(WebSocketSession.class);
        Map<String, Object> attributes = new HashMap<>();
        attributes.put(RealtimeIdentity.SESSION_ATTRIBUTE, identity);
        when(session.getId()).thenReturn(id);
        when(session.getAttributes()).thenReturn(attributes);
        return session;
    }

    private static RealtimeIdentity identity(String id, Instant expiresAt) {
        CredentialClaims claims = new CredentialClaims(id, "teacher", "school-1", null, NOW.minusSeconds(60), expiresAt);
        return new RealtimeIdentity(id, PrincipalKind.STAFF, Role.TEACHER, "school-1", null, claims);
    }

    @Test
    void healthyConnectionsStayOpen() {
        RealtimeIdentity ok = identity("t-1", NOW.plus(Duration.ofDays(1)));
        WebSocketSession open = session("1", ok);
        when(connectionRegistry.connections()).thenReturn(List.of(open));

        assertEquals(0, sweeper.sweep());
        verify(principalAuthenticator).authenticate(ok.claims());
        verify(connectionRegistry, never()).close("1", StaleSessionSweeper.REVOKED);
    }

    @Test
    void expiredCredentialClosesConnection() {
        WebSocketSession expired = session("1", identity("t-1", NOW.minusSeconds(1)));
        when(connectionRegistry.connections()).thenReturn(List.of(expired));

        assertEquals(1, sweeper.sweep());
        verify(connectionRegistry).close("1", StaleSessionSweeper.REVOKED);
        verify(auditService).logSessionRevoked(PrincipalKind.STAFF, "t-1", "EXPIRED_CREDENTIAL");
    }

    @Test
    void deactivatedPrincipalIsDisconnected() {
        RealtimeIdentity identity = identity("t-1", NOW.plus(Duration.ofDays(1)));
        WebSocketSession open = session("1", identity);
        when(connectionRegistry.connections()).thenReturn(List.of(open));
        when(principalAuthenticator.authenticate(identity.claims()))
                .thenThrow(new AuthenticationFailedException(AuthFailureReason.PRINCIPAL_DEACTIVATED));

        assertEquals(1, sweeper.sweep());
        verify(connectionRegistry).close("1", StaleSessionSweeper.REVOKED);
        verify(auditService).logSessionRevoked(PrincipalKind.STAFF, "t-1", "PRINCIPAL_DEACTIVATED");
    }
}
