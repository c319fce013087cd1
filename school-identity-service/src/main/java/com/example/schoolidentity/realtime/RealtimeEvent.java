package com.example.schoolidentity.realtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message pushed to connected clients, serialized as {"type": ..., "payload": {...}}.
 */
public record RealtimeEvent(String type, Map<String, Object> payload) {

    public static final String AUDIENCE_GUARDIAN = "guardian";

    public RealtimeEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Copy addressed to a guardian, tagged with the learner it concerns.
     */
    public RealtimeEvent forGuardian(String studentId) {
        Map<String, Object> copy = new LinkedHashMap<>(payload);
        copy.put("audience", AUDIENCE_GUARDIAN);
        copy.put("studentId", studentId);
        return new RealtimeEvent(type, copy);
    }
}
