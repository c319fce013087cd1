package com.example.schoolidentity.realtime;

import com.example.schoolidentity.exception.AuthFailureReason;
import com.example.schoolidentity.exception.AuthenticationFailedException;
import com.example.schoolidentity.security.PrincipalAuthenticator;
import com.example.schoolidentity.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;

/**
 * Periodically re-authenticates open connections and closes those whose credential has
 * expired or whose principal is gone, deactivated, locked or re-roled since the handshake.
 * Privileges of an open connection are therefore stale for at most one interval.
 */
@Component
@ConditionalOnProperty(name = "realtime.session-sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class StaleSessionSweeper {

    static final CloseStatus REVOKED = CloseStatus.POLICY_VIOLATION.withReason("Session no longer authorized");

    private final ConnectionRegistry connectionRegistry;
    private final PrincipalAuthenticator principalAuthenticator;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * @return number of connections closed
     */
    @Scheduled(fixedDelayString = "${realtime.session-sweep.interval:PT5M}",
               initialDelayString = "${realtime.session-sweep.interval:PT5M}")
    public int sweep() {
        int closed = 0;
        for (WebSocketSession session : connectionRegistry.connections()) {
            Object attribute = session.getAttributes().get(RealtimeIdentity.SESSION_ATTRIBUTE);
            if (!(attribute instanceof RealtimeIdentity identity)) {
                continue;
            }

            AuthFailureReason reason = check(identity);
            if (reason != null) {
                log.info("Closing real-time connection {} of {} {}: {}",
                        session.getId(), identity.role(), identity.principalId(), reason);
                connectionRegistry.close(session.getId(), REVOKED);
                auditService.logSessionRevoked(identity.kind(), identity.principalId(), reason.name());
                closed++;
            }
        }
        if (closed > 0) {
            log.info("Session sweep closed {} connections", closed);
        }
        return closed;
    }

    private AuthFailureReason check(RealtimeIdentity identity) {
        if (!identity.claims().expiresAt().isAfter(clock.instant())) {
            return AuthFailureReason.EXPIRED_CREDENTIAL;
        }
        try {
            principalAuthenticator.authenticate(identity.claims());
            return null;
        } catch (AuthenticationFailedException e) {
            return e.getReason();
        }
    }
}
