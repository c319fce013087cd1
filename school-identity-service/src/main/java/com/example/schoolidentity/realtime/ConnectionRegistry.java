package com.example.schoolidentity.realtime;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open real-time connections and the addresses (mailboxes and rooms) they joined.
 *
 * Sessions are wrapped so concurrent sends from Kafka listeners and the heartbeat
 * handler are serialized per session. All connections are closed on shutdown.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessionIdsByAddress = new ConcurrentHashMap<>();
    private final Map<String, Collection<String>> addressesBySessionId = new ConcurrentHashMap<>();

    private final int sendTimeLimitMillis;
    private final int bufferSizeLimitBytes;

    public ConnectionRegistry(
            @Value("${realtime.send-time-limit-ms:10000}") int sendTimeLimitMillis,
            @Value("${realtime.buffer-size-limit-bytes:524288}") int bufferSizeLimitBytes) {
        this.sendTimeLimitMillis = sendTimeLimitMillis;
        this.bufferSizeLimitBytes = bufferSizeLimitBytes;
    }

    /**
     * @return the thread-safe session to use for all later sends
     */
    public WebSocketSession register(WebSocketSession session, Collection<String> addresses) {
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, bufferSizeLimitBytes);
        sessions.put(session.getId(), safe);
        addressesBySessionId.put(session.getId(), List.copyOf(addresses));
        for (String address : addresses) {
            // join inside compute so a concurrent unregister cannot drop the set mid-add
            sessionIdsByAddress.compute(address, (a, ids) -> {
                Set<String> joined = ids == null ? ConcurrentHashMap.newKeySet() : ids;
                joined.add(session.getId());
                return joined;
            });
        }
        log.debug("Session {} joined {}", session.getId(), addresses);
        return safe;
    }

    public void unregister(String sessionId) {
        sessions.remove(sessionId);
        Collection<String> addresses = addressesBySessionId.remove(sessionId);
        if (addresses == null) {
            return;
        }
        for (String address : addresses) {
            sessionIdsByAddress.computeIfPresent(address, (a, ids) -> {
                ids.remove(sessionId);
                return ids.isEmpty() ? null : ids;
            });
        }
    }

    /**
     * Send to every open session at the address. Sessions that fail are logged and skipped.
     *
     * @return number of sessions the message was handed to
     */
    public int send(String address, TextMessage message) {
        Set<String> ids = sessionIdsByAddress.get(address);
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        int sent = 0;
        for (String id : ids) {
            WebSocketSession session = sessions.get(id);
            if (session == null || !session.isOpen()) {
                continue;
            }
            try {
                session.sendMessage(message);
                sent++;
            } catch (IOException | IllegalStateException | SessionLimitExceededException e) {
                log.warn("Failed to send to session {} at {}: {}", id, address, e.getMessage());
            }
        }
        return sent;
    }

    public Optional<WebSocketSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Collection<WebSocketSession> connections() {
        return List.copyOf(sessions.values());
    }

    public Collection<String> addressesOf(String sessionId) {
        return addressesBySessionId.getOrDefault(sessionId, List.of());
    }

    public int size() {
        return sessions.size();
    }

    public void close(String sessionId, CloseStatus status) {
        WebSocketSession session = sessions.get(sessionId);
        unregister(sessionId);
        if (session == null) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("Error closing session {}: {}", sessionId, e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} real-time connections", sessions.size());
        for (String id : List.copyOf(sessions.keySet())) {
            close(id, CloseStatus.GOING_AWAY);
        }
    }
}
