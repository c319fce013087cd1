package com.example.schoolidentity.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.List;

/**
 * Connection lifecycle for the real-time bus. Clients only send heartbeats;
 * everything else flows server to client through {@link MailboxRouter}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    private static final TextMessage PONG = new TextMessage("{\"type\":\"pong\"}");

    private final ConnectionRegistry connectionRegistry;
    private final MailboxRouter mailboxRouter;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        Object attribute = session.getAttributes().get(RealtimeIdentity.SESSION_ATTRIBUTE);
        if (!(attribute instanceof RealtimeIdentity identity)) {
            // handshake guard did not run for this session
            log.error("Session {} opened without an identity, closing", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        List<String> addresses = mailboxRouter.subscriptionsFor(identity);
        connectionRegistry.register(session, addresses);
        log.info("Real-time connection {} opened for {} {} in {}",
                session.getId(), identity.role(), identity.principalId(), addresses);
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        String type = typeOf(message.getPayload());
        if ("ping".equals(type)) {
            WebSocketSession target = connectionRegistry.find(session.getId()).orElse(session);
            try {
                target.sendMessage(PONG);
            } catch (IOException | IllegalStateException e) {
                log.debug("Could not answer ping on {}: {}", session.getId(), e.getMessage());
            }
            return;
        }
        log.debug("Ignoring inbound message of type {} on {}", type, session.getId());
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("Transport error on {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        connectionRegistry.unregister(session.getId());
        log.info("Real-time connection {} closed: {}", session.getId(), status);
    }

    private String typeOf(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            JsonNode type = node == null ? null : node.get("type");
            return type == null ? null : type.asText();
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
